package ai.formfill.data;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.EnumMap;
import java.util.Map;

/** A stored payment card. The raw number is only ever shown to the user in obfuscated form. */
public record PaymentCard(String guid, Map<FieldType, String> values) implements AutofillRecord {

    public static final String GENERIC_CARD = "genericCC";
    public static final String VISA_CARD = "visaCC";
    public static final String MASTER_CARD = "masterCardCC";
    public static final String AMERICAN_EXPRESS_CARD = "americanExpressCC";
    public static final String DISCOVER_CARD = "discoverCC";

    public PaymentCard {
        var copy = new EnumMap<FieldType, String>(FieldType.class);
        copy.putAll(values);
        values = Map.copyOf(copy);
    }

    @Override
    public String fieldText(FieldType type) {
        var stored = values.getOrDefault(type, "");
        if (!stored.isEmpty()) {
            return stored;
        }
        return switch (type) {
            case CREDIT_CARD_EXP_2_DIGIT_YEAR -> {
                var year = values.getOrDefault(FieldType.CREDIT_CARD_EXP_4_DIGIT_YEAR, "");
                yield year.length() == 4 ? year.substring(2) : "";
            }
            case CREDIT_CARD_EXP_DATE_2_DIGIT_YEAR -> expirationDate(fieldText(FieldType.CREDIT_CARD_EXP_2_DIGIT_YEAR));
            case CREDIT_CARD_EXP_DATE_4_DIGIT_YEAR -> expirationDate(fieldText(FieldType.CREDIT_CARD_EXP_4_DIGIT_YEAR));
            case CREDIT_CARD_TYPE -> brandName();
            default -> "";
        };
    }

    private String expirationDate(String year) {
        var month = values.getOrDefault(FieldType.CREDIT_CARD_EXP_MONTH, "");
        if (month.isEmpty() || year.isEmpty()) {
            return "";
        }
        return Strings.padStart(month, 2, '0') + "/" + year;
    }

    private String digits() {
        return CharMatcher.inRange('0', '9').retainFrom(values.getOrDefault(FieldType.CREDIT_CARD_NUMBER, ""));
    }

    public String lastFourDigits() {
        var digits = digits();
        return digits.length() <= 4 ? digits : digits.substring(digits.length() - 4);
    }

    /** The card number with everything but the last four digits masked. */
    public String obfuscatedNumber() {
        var digits = digits();
        if (digits.length() <= 4) {
            return digits;
        }
        return "*".repeat(digits.length() - 4) + lastFourDigits();
    }

    /** Icon resource tag for the card's brand, derived from the number's issuer prefix. */
    public String brandIcon() {
        var digits = digits();
        if (digits.startsWith("4")) {
            return VISA_CARD;
        }
        if (digits.startsWith("34") || digits.startsWith("37")) {
            return AMERICAN_EXPRESS_CARD;
        }
        if (digits.length() >= 2) {
            int prefix = Integer.parseInt(digits.substring(0, 2));
            if (prefix >= 51 && prefix <= 55) {
                return MASTER_CARD;
            }
        }
        if (digits.startsWith("6011") || digits.startsWith("65")) {
            return DISCOVER_CARD;
        }
        return GENERIC_CARD;
    }

    private String brandName() {
        return switch (brandIcon()) {
            case VISA_CARD -> "Visa";
            case MASTER_CARD -> "MasterCard";
            case AMERICAN_EXPRESS_CARD -> "American Express";
            case DISCOVER_CARD -> "Discover";
            default -> "";
        };
    }
}
