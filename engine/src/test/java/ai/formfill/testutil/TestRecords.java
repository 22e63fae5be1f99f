package ai.formfill.testutil;

import ai.formfill.data.FieldType;
import ai.formfill.data.PaymentCard;
import ai.formfill.data.Profile;
import java.util.Map;

/** Sample stored records. */
public final class TestRecords {
    private TestRecords() {}

    public static Profile elvis() {
        return new Profile(
                "00000000-0000-0000-0000-000000000001",
                Map.of(
                        FieldType.NAME_FIRST, "Elvis",
                        FieldType.NAME_LAST, "Presley",
                        FieldType.EMAIL_ADDRESS, "theking@gmail.com",
                        FieldType.ADDRESS_HOME_LINE1, "3734 Elvis Presley Blvd.",
                        FieldType.ADDRESS_HOME_CITY, "Memphis",
                        FieldType.PHONE_HOME_WHOLE_NUMBER, "12345678901"));
    }

    public static Profile charles() {
        return new Profile(
                "00000000-0000-0000-0000-000000000002",
                Map.of(
                        FieldType.NAME_FIRST, "Charles",
                        FieldType.NAME_LAST, "Holley",
                        FieldType.EMAIL_ADDRESS, "buddy@gmail.com",
                        FieldType.ADDRESS_HOME_LINE1, "123 Apple St.",
                        FieldType.ADDRESS_HOME_CITY, "Lubbock"));
    }

    public static PaymentCard visa() {
        return new PaymentCard(
                "00000000-0000-0000-0000-000000000004",
                Map.of(
                        FieldType.CREDIT_CARD_NAME, "Elvis Presley",
                        FieldType.CREDIT_CARD_NUMBER, "4234567890123456",
                        FieldType.CREDIT_CARD_EXP_MONTH, "04",
                        FieldType.CREDIT_CARD_EXP_4_DIGIT_YEAR, "2012"));
    }

    public static PaymentCard masterCard() {
        return new PaymentCard(
                "00000000-0000-0000-0000-000000000005",
                Map.of(
                        FieldType.CREDIT_CARD_NAME, "Buddy Holly",
                        FieldType.CREDIT_CARD_NUMBER, "5187654321098765",
                        FieldType.CREDIT_CARD_EXP_MONTH, "10",
                        FieldType.CREDIT_CARD_EXP_4_DIGIT_YEAR, "2014"));
    }
}
