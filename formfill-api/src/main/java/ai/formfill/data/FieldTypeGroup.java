package ai.formfill.data;

/** Coarse categories of {@link FieldType}. Identity data is everything that is neither a card nor unknown. */
public enum FieldTypeGroup {
    NO_GROUP,
    NAME,
    EMAIL,
    COMPANY,
    ADDRESS_HOME,
    ADDRESS_BILLING,
    PHONE_HOME,
    PHONE_FAX,
    CREDIT_CARD;

    public boolean isPhoneOrFax() {
        return this == PHONE_HOME || this == PHONE_FAX;
    }
}
