package ai.formfill.data;

import ai.formfill.form.ParsedForm;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The store that owns the user's profiles and payment cards. The engine only reads from it, apart from handing
 * submitted forms over for import.
 */
public interface PersonalDataStore {

    /** Outcome of {@link #importFormData}. {@code paymentCard} is set when a new card was detected but not saved. */
    record ImportResult(boolean imported, @Nullable PaymentCard paymentCard) {
        public static ImportResult none() {
            return new ImportResult(false, null);
        }
    }

    List<Profile> profiles();

    List<PaymentCard> paymentCards();

    default boolean isEmpty() {
        return profiles().isEmpty() && paymentCards().isEmpty();
    }

    /**
     * All types whose stored value equals {@code value} in any record. Returns {@link FieldType#EMPTY_TYPE} for a blank
     * value and {@link FieldType#UNKNOWN_TYPE} when nothing matches.
     */
    Set<FieldType> possibleFieldTypes(String value);

    /**
     * Imports the values of a submitted form. Profile data is saved directly; a detected payment card is returned so the
     * user can be asked before it is kept.
     */
    ImportResult importFormData(ParsedForm submittedForm);

    void saveImportedCard(PaymentCard card);
}
