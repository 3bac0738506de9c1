package run.telo.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class SchemaValidatorTest {
    private static final Map<String, Object> SERVER_SCHEMA = Map.of(
        "type", "object",
        "properties", Map.of(
            "port", Map.of("type", "integer", "minimum", 1, "maximum", 65535),
            "mode", Map.of("enum", List.of("http", "https")),
            "hosts", Map.of("type", "array", "items", Map.of("type", "string"))
        ),
        "required", List.of("port")
    );

    @Test
    void acceptsValidDocuments() {
        var value = Map.of("port", 8080, "mode", "http", "hosts", List.of("a", "b"));
        assertTrue(SchemaValidator.violations(value, SERVER_SCHEMA).isEmpty());
    }

    @Test
    void listsEveryViolation() {
        var value = new LinkedHashMap<String, Object>();
        value.put("port", 70000);
        value.put("mode", "ftp");
        value.put("hosts", List.of("a", 3));

        var violations = SchemaValidator.violations(value, SERVER_SCHEMA);

        assertEquals(List.of("/port must be <= 65535", "/mode must be one of [http, https]", "/hosts/1 must be string (got number)"), violations);
    }

    @Test
    void reportsMissingRequiredFieldsWithTheResource() {
        var id = new ResourceId("Http.Server", "main");

        var error = assertThrows(KernelException.class, () -> SchemaValidator.validate(id, Map.of(), SERVER_SCHEMA));

        assertEquals(ErrorCode.ERR_SCHEMA_VALIDATION, error.code());
        assertEquals(id, error.resource().orElseThrow());
        assertTrue(error.getMessage().contains("/port is required"), error.getMessage());
    }

    @Test
    void shorthandSchemasDescribeProperties() {
        Map<String, Object> shorthand = Map.of("port", Map.of("type", "integer"));

        assertDoesNotThrow(() -> SchemaValidator.validate(new ResourceId("A", "b"), Map.of("port", 1), shorthand));
        assertEquals(List.of("/port must be integer (got string)"), SchemaValidator.violations(Map.of("port", "x"), shorthand));
    }

    @Test
    void closedObjectsRejectUnknownFields() {
        Map<String, Object> closed = Map.of(
            "type", "object",
            "properties", Map.of("name", Map.of("type", "string")),
            "additionalProperties", false
        );

        assertEquals(List.of("/extra is not allowed"), SchemaValidator.violations(Map.of("name", "x", "extra", 1), closed));
    }

    @Test
    void typeListsAcceptAnyListedType() {
        Map<String, Object> schema = Map.of("type", List.of("string", "null"));
        assertTrue(SchemaValidator.violations(null, schema).isEmpty());
        assertEquals(List.of("/ must be one of [string, null] (got boolean)"), SchemaValidator.violations(true, schema));
    }
}
