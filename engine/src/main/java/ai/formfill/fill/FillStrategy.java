package ai.formfill.fill;

import ai.formfill.data.AutofillRecord;
import ai.formfill.data.FieldType;
import ai.formfill.data.PaymentCard;
import ai.formfill.form.FormControlType;
import ai.formfill.form.FormField;

/** How a stored value is written into a particular control. */
enum FillStrategy {
    /** Pick the matching option of a select control. */
    SELECT,
    /** HTML month input: {@code yyyy-mm} from the card's expiration. */
    MONTH,
    /** Local phone number, possibly split across a prefix input and a suffix input. */
    PHONE_SPLIT,
    /** The record's text for the type, unchanged. */
    PLAIN;

    static FillStrategy of(FormField field, FieldType type, AutofillRecord record) {
        if (record instanceof PaymentCard) {
            return switch (field.controlType()) {
                case SELECT_ONE -> SELECT;
                case MONTH -> MONTH;
                default -> PLAIN;
            };
        }
        if (type.phoneSubgroup() == FieldType.PhoneSubgroup.NUMBER) {
            return PHONE_SPLIT;
        }
        return field.controlType() == FormControlType.SELECT_ONE ? SELECT : PLAIN;
    }
}
