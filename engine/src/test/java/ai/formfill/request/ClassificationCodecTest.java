package ai.formfill.request;

import static ai.formfill.data.FieldType.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.formfill.exception.MalformedResponseException;
import ai.formfill.testutil.TestForms;
import ai.formfill.util.Json;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ClassificationCodecTest {

    @Test
    void testDecodeResponse() throws Exception {
        var response = ClassificationCodec.decodeResponse(
                """
                {"experimentId": "ar1",
                 "forms": [{"signature": "123", "fields": [{"type": 3}, {"type": 9}, {"type": 999}, {}]}]}
                """);

        assertEquals("ar1", response.experimentId());
        assertEquals(1, response.forms().size());
        var form = response.forms().get(0);
        assertEquals("123", form.signature());
        assertEquals(List.of(NAME_FIRST, EMAIL_ADDRESS, NO_SERVER_DATA, NO_SERVER_DATA), form.fieldTypes());
    }

    @Test
    void testMissingExperimentIdIsEmpty() throws Exception {
        var response = ClassificationCodec.decodeResponse("{\"forms\": []}");
        assertEquals("", response.experimentId());
        assertTrue(response.forms().isEmpty());
    }

    @Test
    void testMalformedResponses() {
        assertThrows(MalformedResponseException.class, () -> ClassificationCodec.decodeResponse("not json"));
        assertThrows(MalformedResponseException.class, () -> ClassificationCodec.decodeResponse("[1, 2]"));
        assertThrows(MalformedResponseException.class, () -> ClassificationCodec.decodeResponse("{}"));
        assertThrows(MalformedResponseException.class, () -> ClassificationCodec.decodeResponse("{\"forms\": 3}"));
        assertThrows(
                MalformedResponseException.class,
                () -> ClassificationCodec.decodeResponse("{\"forms\": [{\"fields\": []}]}"));
    }

    @Test
    void testEncodeQuery() throws Exception {
        var a = TestForms.parsed(NAME_FIRST, NAME_LAST, EMAIL_ADDRESS);
        var root = Json.getMapper().readTree(ClassificationCodec.encodeQuery(List.of(a)));

        assertEquals(ClassificationCodec.CLIENT_VERSION, root.get("clientVersion").asText());
        var form = root.get("forms").get(0);
        assertEquals(a.signature(), form.get("signature").asText());
        assertEquals(3, form.get("fields").size());
        assertEquals(a.field(1).fieldSignature(), form.get("fields").get(1).get("signature").asText());
    }

    @Test
    void testEncodeUpload() throws Exception {
        var form = TestForms.parsed(NAME_FIRST, NAME_LAST, EMAIL_ADDRESS);
        form.setPossibleTypes(0, Set.of(NAME_FULL, NAME_FIRST));
        form.setPossibleTypes(1, Set.of(EMPTY_TYPE));

        var root = Json.getMapper().readTree(ClassificationCodec.encodeUpload(form, true, 0.5));

        assertEquals(form.signature(), root.get("formSignature").asText());
        assertTrue(root.get("autofillUsed").asBoolean());
        assertEquals(0.5, root.get("uploadRate").asDouble());
        var fields = root.get("fields");
        assertEquals(3, fields.size());
        assertEquals(NAME_FIRST.serverId(), fields.get(0).get("possibleTypes").get(0).asInt());
        assertEquals(NAME_FULL.serverId(), fields.get(0).get("possibleTypes").get(1).asInt());
        assertEquals(EMPTY_TYPE.serverId(), fields.get(1).get("possibleTypes").get(0).asInt());
        assertEquals(0, fields.get(2).get("possibleTypes").size());
    }
}
