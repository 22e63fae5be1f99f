package ai.formfill.form;

import java.util.Locale;

/** The kind of input control backing a form field, as reported by the renderer. */
public enum FormControlType {
    TEXT("text"),
    EMAIL("email"),
    TEL("tel"),
    PASSWORD("password"),
    TEXTAREA("textarea"),
    SELECT_ONE("select-one"),
    MONTH("month"),
    CHECKBOX("checkbox");

    private final String htmlName;

    FormControlType(String htmlName) {
        this.htmlName = htmlName;
    }

    public String htmlName() {
        return htmlName;
    }

    /** Maps an HTML control type to a constant; unrecognized types are treated as plain text. */
    public static FormControlType fromHtml(String html) {
        var normalized = html.trim().toLowerCase(Locale.ROOT);
        for (var type : values()) {
            if (type.htmlName.equals(normalized)) {
                return type;
            }
        }
        return TEXT;
    }
}
