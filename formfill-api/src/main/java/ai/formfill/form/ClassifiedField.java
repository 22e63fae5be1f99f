package ai.formfill.form;

import ai.formfill.data.FieldType;
import ai.formfill.data.FieldTypeGroup;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Set;

/**
 * A field inside a {@link ParsedForm}: the control snapshot taken when the form was parsed, plus the types predicted for
 * it. Server predictions arrive later and replace the heuristic type as the effective type.
 */
public final class ClassifiedField {
    private final FormField field;
    private final FieldType heuristicType;
    private FieldType serverType = FieldType.NO_SERVER_DATA;
    private final EnumSet<FieldType> possibleTypes = EnumSet.noneOf(FieldType.class);
    private final String fieldSignature;

    public ClassifiedField(FormField field, FieldType heuristicType) {
        this.field = field;
        this.heuristicType = heuristicType;
        this.fieldSignature = Integer.toUnsignedString(Hashing.sha256()
                .hashString(field.name() + "&" + field.controlType().htmlName(), StandardCharsets.UTF_8)
                .asInt());
    }

    public FormField field() {
        return field;
    }

    public FieldType heuristicType() {
        return heuristicType;
    }

    public FieldType serverType() {
        return serverType;
    }

    void setServerType(FieldType type) {
        this.serverType = type;
    }

    /** The server prediction when one exists, otherwise the heuristic prediction. */
    public FieldType effectiveType() {
        return serverType != FieldType.NO_SERVER_DATA ? serverType : heuristicType;
    }

    public FieldTypeGroup group() {
        return effectiveType().group();
    }

    /** Types the submitted value was found under in stored data; empty until the form is submitted. */
    public Set<FieldType> possibleTypes() {
        return Set.copyOf(possibleTypes);
    }

    void setPossibleTypes(Set<FieldType> types) {
        possibleTypes.clear();
        possibleTypes.addAll(types);
    }

    public String fieldSignature() {
        return fieldSignature;
    }

    public boolean matches(FormField other) {
        return field.sameControlAs(other);
    }

    @Override
    public String toString() {
        return "ClassifiedField[" + field.name() + ": " + effectiveType() + "]";
    }
}
