package ai.formfill.suggest;

import ai.formfill.data.FieldType;
import ai.formfill.data.Profile;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds the secondary text shown under each profile suggestion. Labels draw on the other fields present in the form,
 * in form order, and grow only as long as they are needed to tell otherwise identical profiles apart.
 */
final class ProfileLabeler {
    static final String SEPARATOR = ", ";

    private ProfileLabeler() {}

    /**
     * @param formTypes effective types of every field in the form, in order
     * @param excludedType the type of the field being queried; its value is already the suggestion text
     * @param minimalFields how many label parts each profile gets even when it is already unique
     */
    static List<String> inferLabels(
            List<Profile> profiles, List<FieldType> formTypes, FieldType excludedType, int minimalFields) {
        var candidates = new LinkedHashSet<FieldType>();
        for (var type : formTypes) {
            if (!type.isUnknown() && !type.isPayment() && type != excludedType) {
                candidates.add(type);
            }
        }

        var parts = new ArrayList<List<String>>(profiles.size());
        for (int i = 0; i < profiles.size(); i++) {
            parts.add(new ArrayList<>());
        }

        for (var type : candidates) {
            var before = parts.stream().map(p -> String.join(SEPARATOR, p)).toList();
            for (int i = 0; i < profiles.size(); i++) {
                var value = profiles.get(i).fieldText(type);
                if (value.isEmpty()) {
                    continue;
                }
                if (parts.get(i).size() < minimalFields || distinguishes(profiles, before, i, type, value)) {
                    parts.get(i).add(value);
                }
            }
        }

        return parts.stream().map(p -> String.join(SEPARATOR, p)).toList();
    }

    /** Whether some other profile with the same label so far has a different value for {@code type}. */
    private static boolean distinguishes(
            List<Profile> profiles, List<String> labelsSoFar, int index, FieldType type, String value) {
        for (int j = 0; j < profiles.size(); j++) {
            if (j != index
                    && labelsSoFar.get(j).equals(labelsSoFar.get(index))
                    && !profiles.get(j).fieldText(type).equals(value)) {
                return true;
            }
        }
        return false;
    }
}
