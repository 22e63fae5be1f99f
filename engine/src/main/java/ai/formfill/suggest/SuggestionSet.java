package ai.formfill.suggest;

import ai.formfill.ids.GuidPacker;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * The rows offered for one query, as four index-aligned lists. Every operation keeps the lists the same length and in
 * the same relative order.
 */
public record SuggestionSet(List<String> values, List<String> labels, List<String> icons, List<Integer> uniqueIds) {

    public SuggestionSet {
        if (labels.size() != values.size() || icons.size() != values.size() || uniqueIds.size() != values.size()) {
            throw new IllegalArgumentException("Suggestion lists differ in length: values=%d labels=%d icons=%d ids=%d"
                    .formatted(values.size(), labels.size(), icons.size(), uniqueIds.size()));
        }
        values = List.copyOf(values);
        labels = List.copyOf(labels);
        icons = List.copyOf(icons);
        uniqueIds = List.copyOf(uniqueIds);
    }

    public static SuggestionSet empty() {
        return new SuggestionSet(List.of(), List.of(), List.of(), List.of());
    }

    /** A single informational row that cannot be selected for filling. */
    public static SuggestionSet warning(String message) {
        return new SuggestionSet(List.of(message), List.of(""), List.of(""), List.of(GuidPacker.INVALID_ID));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Drops rows whose (value, label) pair already appeared earlier; the first occurrence wins. */
    public SuggestionSet withoutDuplicates() {
        var seen = new HashSet<Map.Entry<String, String>>();
        var builder = new Builder();
        for (int i = 0; i < size(); i++) {
            if (seen.add(Map.entry(values.get(i), labels.get(i)))) {
                builder.add(values.get(i), labels.get(i), icons.get(i), uniqueIds.get(i));
            }
        }
        return builder.build();
    }

    /** Same rows with every label and icon cleared, as a plain autocomplete list would show them. */
    public SuggestionSet withBlankLabelsAndIcons() {
        var blanks = Collections.nCopies(size(), "");
        return new SuggestionSet(values, blanks, blanks, uniqueIds);
    }

    public static final class Builder {
        private final List<String> values = new ArrayList<>();
        private final List<String> labels = new ArrayList<>();
        private final List<String> icons = new ArrayList<>();
        private final List<Integer> uniqueIds = new ArrayList<>();

        public Builder add(String value, String label, String icon, int uniqueId) {
            values.add(value);
            labels.add(label);
            icons.add(icon);
            uniqueIds.add(uniqueId);
            return this;
        }

        public SuggestionSet build() {
            return new SuggestionSet(values, labels, icons, uniqueIds);
        }
    }
}
