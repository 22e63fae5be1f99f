package ai.formfill.fill;

import ai.formfill.data.FieldType;
import ai.formfill.form.FormField;
import ai.formfill.form.SelectControlFiller;
import ai.formfill.form.SelectOption;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Default {@link SelectControlFiller}: an option matches when its value or its display text equals the stored value,
 * ignoring case. Expiration months also match by number ("4" and "04") and by English month name.
 */
public final class OptionSelectFiller implements SelectControlFiller {

    @Override
    public Optional<String> selectOption(FormField field, FieldType type, String value) {
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (var option : field.options()) {
            if (option.value().equalsIgnoreCase(value) || option.text().equalsIgnoreCase(value)) {
                return Optional.of(option.value());
            }
        }
        if (type == FieldType.CREDIT_CARD_EXP_MONTH) {
            var month = parseMonth(value);
            if (month.isPresent()) {
                for (var option : field.options()) {
                    if (matchesMonth(option, month.getAsInt())) {
                        return Optional.of(option.value());
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean matchesMonth(SelectOption option, int month) {
        if (parseMonth(option.value()).equals(OptionalInt.of(month))
                || parseMonth(option.text()).equals(OptionalInt.of(month))) {
            return true;
        }
        var m = Month.of(month);
        var text = option.text().trim();
        return text.equalsIgnoreCase(m.getDisplayName(TextStyle.FULL, Locale.US))
                || text.equalsIgnoreCase(m.getDisplayName(TextStyle.SHORT, Locale.US));
    }

    private static OptionalInt parseMonth(String text) {
        try {
            int month = Integer.parseInt(text.trim());
            return month >= 1 && month <= 12 ? OptionalInt.of(month) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
