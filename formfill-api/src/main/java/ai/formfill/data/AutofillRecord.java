package ai.formfill.data;

/** A stored record that can supply values for form fields. */
public sealed interface AutofillRecord permits Profile, PaymentCard {

    String guid();

    /**
     * The text this record holds for {@code type}, including values derived from other stored fields. Never null;
     * empty when the record has nothing for the type.
     */
    String fieldText(FieldType type);
}
