package ai.formfill.testutil;

import ai.formfill.data.FieldType;
import ai.formfill.form.FormControlType;
import ai.formfill.form.FormData;
import ai.formfill.form.FormField;
import ai.formfill.form.ParsedForm;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Builders for forms used across engine tests. */
public final class TestForms {
    public static final URI SECURE_ORIGIN = URI.create("https://shop.example.com/checkout");
    public static final URI INSECURE_ORIGIN = URI.create("http://shop.example.com/checkout");
    public static final URI ACTION = URI.create("https://shop.example.com/submit");

    private TestForms() {}

    public static FormField field(String name) {
        return FormField.text(name, name, "");
    }

    public static FormField field(String name, FormControlType controlType) {
        return new FormField(name, name, "", controlType, 0, false, List.of());
    }

    public static FormData form(String name, FormField... fields) {
        return form(name, SECURE_ORIGIN, FormData.Method.POST, fields);
    }

    public static FormData form(String name, URI origin, FormData.Method method, FormField... fields) {
        return new FormData(name, method, origin, ACTION, Arrays.asList(fields), true);
    }

    /** A secure POST form submitting to {@code action} instead of {@link #ACTION}. */
    public static FormData formPostingTo(String name, URI action, FormField... fields) {
        return new FormData(name, FormData.Method.POST, SECURE_ORIGIN, action, Arrays.asList(fields), true);
    }

    /** A parsed form whose fields are named {@code f0, f1, ...} and carry the given heuristic types. */
    public static ParsedForm parsed(FieldType... types) {
        var fields = new ArrayList<FormField>();
        for (int i = 0; i < types.length; i++) {
            fields.add(field("f" + i));
        }
        return ParsedForm.fromHeuristics(form("typed", fields.toArray(FormField[]::new)), Arrays.asList(types));
    }
}
