package ai.formfill.form;

import java.util.List;

/**
 * One input control as currently rendered. Instances are immutable snapshots; filling produces a new instance through
 * {@link #withFilledValue(String)}.
 *
 * @param maxLength the control's maximum length, or 0 when the page sets none
 */
public record FormField(
        String label,
        String name,
        String value,
        FormControlType controlType,
        int maxLength,
        boolean autofilled,
        List<SelectOption> options) {

    public FormField {
        options = List.copyOf(options);
    }

    public static FormField text(String label, String name, String value) {
        return new FormField(label, name, value, FormControlType.TEXT, 0, false, List.of());
    }

    /**
     * True when {@code other} denotes the same control: label, name and control type agree. The current value and
     * autofill state are ignored.
     */
    public boolean sameControlAs(FormField other) {
        return label.equals(other.label) && name.equals(other.name) && controlType == other.controlType;
    }

    public FormField withValue(String newValue) {
        return new FormField(label, name, newValue, controlType, maxLength, autofilled, options);
    }

    public FormField withFilledValue(String newValue) {
        return new FormField(label, name, newValue, controlType, maxLength, true, options);
    }

    public FormField withAutofilled(boolean isAutofilled) {
        return new FormField(label, name, value, controlType, maxLength, isAutofilled, options);
    }

    public FormField withMaxLength(int length) {
        return new FormField(label, name, value, controlType, length, autofilled, options);
    }
}
