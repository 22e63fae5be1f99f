package ai.formfill.form;

/** One {@code <option>} of a select control. */
public record SelectOption(String value, String text) {}
