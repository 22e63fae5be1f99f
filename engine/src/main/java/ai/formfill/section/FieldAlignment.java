package ai.formfill.section;

import ai.formfill.form.FormField;
import ai.formfill.form.ParsedForm;
import java.util.ArrayList;
import java.util.List;

/**
 * Pairs the fields of a cached form with the fields of the live form, which the page may have changed since it was
 * parsed. Two cursors move forward independently: for each live field the cached cursor searches ahead, up to a limit,
 * for the same control. A hit advances both cursors past the pair; a miss skips only the live field. Neither cursor
 * ever moves backwards.
 */
public final class FieldAlignment {

    /** A cached field index paired with the index of the same control in the live field list. */
    public record Match(int cachedIndex, int liveIndex) {}

    private FieldAlignment() {}

    /**
     * @param range cached fields to pair; pairing stops once the cached cursor leaves it
     * @param searchLimit exclusive bound on how far ahead the cached cursor may look
     */
    public static List<Match> align(ParsedForm cached, SectionRange range, int searchLimit, List<FormField> live) {
        int limit = Math.min(searchLimit, cached.fieldCount());
        var matches = new ArrayList<Match>();
        int i = range.start();
        for (int j = 0; i < range.end() && j < live.size(); j++) {
            int k = i;
            while (k < limit && !cached.field(k).matches(live.get(j))) {
                k++;
            }
            if (k >= limit) {
                continue;
            }
            matches.add(new Match(k, j));
            i = k + 1;
        }
        return matches;
    }
}
