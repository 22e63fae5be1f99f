package ai.formfill.form;

import ai.formfill.data.FieldType;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The cached, classified version of a form. The field list and signature never change after construction; server
 * types, the experiment id and possible types are filled in later.
 */
public final class ParsedForm {
    /** Forms with fewer fields than this are never parsed or filled. */
    public static final int REQUIRED_FILLABLE_FIELDS = 3;

    private final String formName;
    private final URI sourceUrl;
    private final URI targetUrl;
    private final FormData.Method method;
    private final boolean secure;
    private final ImmutableList<ClassifiedField> fields;
    private final String signature;
    private String experimentId = "";

    private ParsedForm(FormData form, List<ClassifiedField> fields) {
        this.formName = form.name();
        this.sourceUrl = form.origin();
        this.targetUrl = form.action();
        this.method = form.method();
        this.secure = form.isSecure();
        this.fields = ImmutableList.copyOf(fields);
        this.signature = computeSignature(form);
    }

    /**
     * Builds a parsed form from the heuristic type of each field.
     *
     * @throws IllegalArgumentException if the type list and the field list differ in length
     */
    public static ParsedForm fromHeuristics(FormData form, List<FieldType> heuristicTypes) {
        if (heuristicTypes.size() != form.fields().size()) {
            throw new IllegalArgumentException("Expected %d heuristic types for form '%s', got %d"
                    .formatted(form.fields().size(), form.name(), heuristicTypes.size()));
        }
        var classified = new ArrayList<ClassifiedField>(form.fields().size());
        for (int i = 0; i < form.fields().size(); i++) {
            classified.add(new ClassifiedField(form.fields().get(i), heuristicTypes.get(i)));
        }
        return new ParsedForm(form, classified);
    }

    private static String computeSignature(FormData form) {
        var sb = new StringBuilder()
                .append(Objects.requireNonNullElse(form.origin().getScheme(), ""))
                .append("://")
                .append(Objects.requireNonNullElse(form.origin().getHost(), ""))
                .append('&')
                .append(form.name());
        for (var field : form.fields()) {
            sb.append('&').append(field.name());
        }
        return Long.toUnsignedString(
                Hashing.sha256().hashString(sb, StandardCharsets.UTF_8).asLong());
    }

    public String formName() {
        return formName;
    }

    public URI sourceUrl() {
        return sourceUrl;
    }

    public URI targetUrl() {
        return targetUrl;
    }

    public String signature() {
        return signature;
    }

    public String experimentId() {
        return experimentId;
    }

    public List<ClassifiedField> fields() {
        return fields;
    }

    public ClassifiedField field(int index) {
        return fields.get(index);
    }

    public int fieldCount() {
        return fields.size();
    }

    public List<FieldType> fieldTypes() {
        return fields.stream().map(ClassifiedField::effectiveType).toList();
    }

    /** Number of fields whose effective type is known. */
    public int autofillCount() {
        return (int) fields.stream().filter(f -> !f.effectiveType().isUnknown()).count();
    }

    public boolean isSecure() {
        return secure;
    }

    /**
     * Whether the form is worth classifying at all: enough fields, not a search form, and (when required) submitted
     * with POST.
     */
    public boolean shouldBeParsed(boolean requireMethodPost) {
        if (fieldCount() < REQUIRED_FILLABLE_FIELDS) {
            return false;
        }
        if ("/search".equals(targetUrl.getPath())) {
            return false;
        }
        return !requireMethodPost || method == FormData.Method.POST;
    }

    public boolean isAutofillable(boolean requireMethodPost) {
        return autofillCount() >= REQUIRED_FILLABLE_FIELDS && shouldBeParsed(requireMethodPost);
    }

    /** Identity test against a live form: name, origin and action must agree. Fields may have drifted. */
    public boolean matches(FormData form) {
        return formName.equals(form.name()) && sourceUrl.equals(form.origin()) && targetUrl.equals(form.action());
    }

    public OptionalInt indexOf(FormField field) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).matches(field)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Applies server predictions, one per field in order.
     *
     * @return false, leaving the form untouched, when the number of types does not match the number of fields
     */
    public boolean updateFromServer(List<FieldType> serverTypes, String serverExperimentId) {
        if (serverTypes.size() != fields.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            fields.get(i).setServerType(serverTypes.get(i));
        }
        this.experimentId = serverExperimentId;
        return true;
    }

    public void setPossibleTypes(int index, Set<FieldType> types) {
        fields.get(index).setPossibleTypes(types);
    }

    @Override
    public String toString() {
        return "ParsedForm[" + formName + " @ " + sourceUrl + ", " + fields.size() + " fields, sig=" + signature + "]";
    }
}
