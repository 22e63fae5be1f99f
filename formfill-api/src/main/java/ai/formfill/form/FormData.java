package ai.formfill.form;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** A page's form as observed right now. */
public record FormData(
        String name, Method method, URI origin, URI action, List<FormField> fields, boolean userSubmitted) {

    public enum Method {
        GET,
        POST;

        public static Method parse(String method) {
            return "post".equals(method.trim().toLowerCase(Locale.ROOT)) ? POST : GET;
        }
    }

    public FormData {
        fields = List.copyOf(fields);
    }

    /** Forms delivered over an encrypted transport are the only ones eligible for card filling. */
    public boolean isSecure() {
        return "https".equalsIgnoreCase(origin.getScheme());
    }

    public FormData withFields(List<FormField> newFields) {
        return new FormData(name, method, origin, action, newFields, userSubmitted);
    }

    public FormData withUserSubmitted(boolean submitted) {
        return new FormData(name, method, origin, action, fields, submitted);
    }
}
