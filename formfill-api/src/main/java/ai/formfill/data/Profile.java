package ai.formfill.data;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

/** A stored identity record: names, email, company, addresses and phone numbers. */
public record Profile(String guid, Map<FieldType, String> values) implements AutofillRecord {

    private static final int LOCAL_NUMBER_LENGTH = 7;
    private static final int CITY_CODE_LENGTH = 3;

    public Profile {
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
        if (type.group() == FieldTypeGroup.ADDRESS_BILLING) {
            return values.getOrDefault(type.equivalentType(), "");
        }
        return switch (type) {
            case NAME_FULL -> Joiner.on(' ')
                    .join(Stream.of(FieldType.NAME_FIRST, FieldType.NAME_MIDDLE, FieldType.NAME_LAST)
                            .map(t -> values.getOrDefault(t, ""))
                            .filter(s -> !s.isEmpty())
                            .iterator());
            case NAME_MIDDLE_INITIAL -> {
                var middle = values.getOrDefault(FieldType.NAME_MIDDLE, "");
                yield middle.isEmpty() ? "" : middle.substring(0, 1);
            }
            default -> type.phoneSubgroup() == FieldType.PhoneSubgroup.NONE ? "" : phonePart(type);
        };
    }

    /**
     * Splits the stored whole number of the type's group into country code, 3-digit city code and 7-digit local
     * number.
     */
    private String phonePart(FieldType type) {
        var whole = type.group() == FieldTypeGroup.PHONE_FAX
                ? FieldType.PHONE_FAX_WHOLE_NUMBER
                : FieldType.PHONE_HOME_WHOLE_NUMBER;
        var digits = CharMatcher.inRange('0', '9').retainFrom(values.getOrDefault(whole, ""));
        if (digits.length() < LOCAL_NUMBER_LENGTH) {
            return type.phoneSubgroup() == FieldType.PhoneSubgroup.NUMBER ? digits : "";
        }
        var local = digits.substring(digits.length() - LOCAL_NUMBER_LENGTH);
        var rest = digits.substring(0, digits.length() - LOCAL_NUMBER_LENGTH);
        var city = rest.length() >= CITY_CODE_LENGTH ? rest.substring(rest.length() - CITY_CODE_LENGTH) : rest;
        var country = rest.substring(0, rest.length() - city.length());
        return switch (type.phoneSubgroup()) {
            case NUMBER -> local;
            case CITY_CODE -> city;
            case COUNTRY_CODE -> country;
            case CITY_AND_NUMBER -> city + local;
            case WHOLE_NUMBER -> digits;
            case NONE -> "";
        };
    }
}
