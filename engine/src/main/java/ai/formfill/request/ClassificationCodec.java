package ai.formfill.request;

import ai.formfill.data.FieldType;
import ai.formfill.exception.MalformedResponseException;
import ai.formfill.form.ClassifiedField;
import ai.formfill.form.ParsedForm;
import ai.formfill.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * JSON encoding of classification queries and uploads, and decoding of query responses.
 *
 * <p>Response shape:
 *
 * <pre>{@code
 * {"experimentId": "ar1",
 *  "forms": [{"signature": "1234", "fields": [{"type": 3}, {"type": 9}]}]}
 * }</pre>
 */
public final class ClassificationCodec {
    static final String CLIENT_VERSION = "6.1";

    /** Server predictions for one form, one type per field in form order. */
    public record FormPrediction(String signature, List<FieldType> fieldTypes) {}

    public record QueryResponse(String experimentId, List<FormPrediction> forms) {}

    private ClassificationCodec() {}

    public static String encodeQuery(List<ParsedForm> forms) {
        var root = Json.getMapper().createObjectNode();
        root.put("clientVersion", CLIENT_VERSION);
        var formsNode = root.putArray("forms");
        for (var form : forms) {
            var formNode = formsNode.addObject();
            formNode.put("signature", form.signature());
            var fieldsNode = formNode.putArray("fields");
            for (var field : form.fields()) {
                fieldsNode.addObject().put("signature", field.fieldSignature());
            }
        }
        return write(root);
    }

    public static String encodeUpload(ParsedForm form, boolean autofillUsed, double uploadRate) {
        var root = Json.getMapper().createObjectNode();
        root.put("clientVersion", CLIENT_VERSION);
        root.put("formSignature", form.signature());
        root.put("autofillUsed", autofillUsed);
        root.put("uploadRate", uploadRate);
        var fieldsNode = root.putArray("fields");
        for (ClassifiedField field : form.fields()) {
            var fieldNode = fieldsNode.addObject();
            fieldNode.put("signature", field.fieldSignature());
            var typesNode = fieldNode.putArray("possibleTypes");
            field.possibleTypes().stream()
                    .map(FieldType::serverId)
                    .sorted(Comparator.naturalOrder())
                    .forEach(typesNode::add);
        }
        return write(root);
    }

    /**
     * @throws MalformedResponseException if the payload is not JSON or lacks the {@code forms} array
     */
    public static QueryResponse decodeResponse(String payload) throws MalformedResponseException {
        JsonNode root;
        try {
            root = Json.getMapper().readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Classification response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Classification response is not a JSON object");
        }
        var formsNode = root.get("forms");
        if (formsNode == null || !formsNode.isArray()) {
            throw new MalformedResponseException("Classification response has no forms array");
        }

        var forms = new ArrayList<FormPrediction>();
        for (var formNode : formsNode) {
            var signature = formNode.path("signature").asText("");
            if (signature.isEmpty()) {
                throw new MalformedResponseException("Form prediction without signature");
            }
            var types = new ArrayList<FieldType>();
            for (var fieldNode : formNode.path("fields")) {
                types.add(FieldType.fromServerId(fieldNode.path("type").asInt(FieldType.NO_SERVER_DATA.serverId()))
                        .orElse(FieldType.NO_SERVER_DATA));
            }
            forms.add(new FormPrediction(signature, List.copyOf(types)));
        }
        return new QueryResponse(root.path("experimentId").asText(""), List.copyOf(forms));
    }

    private static String write(ObjectNode node) {
        try {
            return Json.getMapper().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize classification request", e);
        }
    }
}
