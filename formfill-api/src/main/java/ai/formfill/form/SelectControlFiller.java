package ai.formfill.form;

import ai.formfill.data.FieldType;
import java.util.Optional;

/** Chooses the option of a select control that represents a stored value. */
@FunctionalInterface
public interface SelectControlFiller {

    /**
     * @return the option value to select, or empty when no option corresponds to {@code value}
     */
    Optional<String> selectOption(FormField field, FieldType type, String value);
}
