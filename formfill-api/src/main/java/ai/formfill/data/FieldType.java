package ai.formfill.data;

import java.util.Optional;

/**
 * The autofill type vocabulary. Each constant carries the numeric id used by the classification server, the coarse
 * {@link FieldTypeGroup} used for sectioning, and the phone subgroup used when formatting phone numbers.
 */
public enum FieldType {
    NO_SERVER_DATA(0, FieldTypeGroup.NO_GROUP),
    UNKNOWN_TYPE(1, FieldTypeGroup.NO_GROUP),
    EMPTY_TYPE(2, FieldTypeGroup.NO_GROUP),

    NAME_FIRST(3, FieldTypeGroup.NAME),
    NAME_MIDDLE(4, FieldTypeGroup.NAME),
    NAME_LAST(5, FieldTypeGroup.NAME),
    NAME_MIDDLE_INITIAL(6, FieldTypeGroup.NAME),
    NAME_FULL(7, FieldTypeGroup.NAME),
    NAME_SUFFIX(8, FieldTypeGroup.NAME),
    EMAIL_ADDRESS(9, FieldTypeGroup.EMAIL),

    PHONE_HOME_NUMBER(10, FieldTypeGroup.PHONE_HOME, PhoneSubgroup.NUMBER),
    PHONE_HOME_CITY_CODE(11, FieldTypeGroup.PHONE_HOME, PhoneSubgroup.CITY_CODE),
    PHONE_HOME_COUNTRY_CODE(12, FieldTypeGroup.PHONE_HOME, PhoneSubgroup.COUNTRY_CODE),
    PHONE_HOME_CITY_AND_NUMBER(13, FieldTypeGroup.PHONE_HOME, PhoneSubgroup.CITY_AND_NUMBER),
    PHONE_HOME_WHOLE_NUMBER(14, FieldTypeGroup.PHONE_HOME, PhoneSubgroup.WHOLE_NUMBER),

    PHONE_FAX_NUMBER(20, FieldTypeGroup.PHONE_FAX, PhoneSubgroup.NUMBER),
    PHONE_FAX_CITY_CODE(21, FieldTypeGroup.PHONE_FAX, PhoneSubgroup.CITY_CODE),
    PHONE_FAX_COUNTRY_CODE(22, FieldTypeGroup.PHONE_FAX, PhoneSubgroup.COUNTRY_CODE),
    PHONE_FAX_CITY_AND_NUMBER(23, FieldTypeGroup.PHONE_FAX, PhoneSubgroup.CITY_AND_NUMBER),
    PHONE_FAX_WHOLE_NUMBER(24, FieldTypeGroup.PHONE_FAX, PhoneSubgroup.WHOLE_NUMBER),

    ADDRESS_HOME_LINE1(30, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_LINE2(31, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_APT_NUM(32, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_CITY(33, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_STATE(34, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_ZIP(35, FieldTypeGroup.ADDRESS_HOME),
    ADDRESS_HOME_COUNTRY(36, FieldTypeGroup.ADDRESS_HOME),

    ADDRESS_BILLING_LINE1(37, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_LINE2(38, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_APT_NUM(39, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_CITY(40, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_STATE(41, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_ZIP(42, FieldTypeGroup.ADDRESS_BILLING),
    ADDRESS_BILLING_COUNTRY(43, FieldTypeGroup.ADDRESS_BILLING),

    CREDIT_CARD_NAME(51, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_NUMBER(52, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_EXP_MONTH(53, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_EXP_2_DIGIT_YEAR(54, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_EXP_4_DIGIT_YEAR(55, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_EXP_DATE_2_DIGIT_YEAR(56, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_EXP_DATE_4_DIGIT_YEAR(57, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_TYPE(58, FieldTypeGroup.CREDIT_CARD),
    CREDIT_CARD_VERIFICATION_CODE(59, FieldTypeGroup.CREDIT_CARD),

    COMPANY_NAME(60, FieldTypeGroup.COMPANY);

    /** Subdivision of the phone and fax groups; {@link #NONE} for every other type. */
    public enum PhoneSubgroup {
        NONE,
        NUMBER,
        CITY_CODE,
        COUNTRY_CODE,
        CITY_AND_NUMBER,
        WHOLE_NUMBER
    }

    private final int serverId;
    private final FieldTypeGroup group;
    private final PhoneSubgroup phoneSubgroup;

    FieldType(int serverId, FieldTypeGroup group) {
        this(serverId, group, PhoneSubgroup.NONE);
    }

    FieldType(int serverId, FieldTypeGroup group, PhoneSubgroup phoneSubgroup) {
        this.serverId = serverId;
        this.group = group;
        this.phoneSubgroup = phoneSubgroup;
    }

    public int serverId() {
        return serverId;
    }

    public FieldTypeGroup group() {
        return group;
    }

    public PhoneSubgroup phoneSubgroup() {
        return phoneSubgroup;
    }

    /** True for the placeholder types that never identify real data. */
    public boolean isUnknown() {
        return group == FieldTypeGroup.NO_GROUP;
    }

    public boolean isPayment() {
        return group == FieldTypeGroup.CREDIT_CARD;
    }

    /**
     * Billing address types are interchangeable with home address types when deciding where one logical section ends
     * and the next begins.
     */
    public FieldType equivalentType() {
        return switch (this) {
            case ADDRESS_BILLING_LINE1 -> ADDRESS_HOME_LINE1;
            case ADDRESS_BILLING_LINE2 -> ADDRESS_HOME_LINE2;
            case ADDRESS_BILLING_APT_NUM -> ADDRESS_HOME_APT_NUM;
            case ADDRESS_BILLING_CITY -> ADDRESS_HOME_CITY;
            case ADDRESS_BILLING_STATE -> ADDRESS_HOME_STATE;
            case ADDRESS_BILLING_ZIP -> ADDRESS_HOME_ZIP;
            case ADDRESS_BILLING_COUNTRY -> ADDRESS_HOME_COUNTRY;
            default -> this;
        };
    }

    public static Optional<FieldType> fromServerId(int serverId) {
        for (var type : values()) {
            if (type.serverId == serverId) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
