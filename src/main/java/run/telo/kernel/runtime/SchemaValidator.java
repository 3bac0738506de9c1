package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import run.telo.kernel.shared.Values;

/**
 * Structural validator for the JSON-Schema subset used by resource definitions: {@code type}, {@code properties},
 * {@code required}, {@code additionalProperties: false}, {@code enum}, {@code items}, {@code minimum} and
 * {@code maximum}. A schema without a string {@code type} is shorthand for an object whose properties it lists.
 */
public final class SchemaValidator {
    private SchemaValidator() {}

    public static void validate(ResourceId subject, Object value, Map<String, Object> schema) {
        var violations = violations(value, schema);
        if (!violations.isEmpty()) {
            throw new KernelException(
                ErrorCode.ERR_SCHEMA_VALIDATION,
                subject,
                "Invalid value for " + subject + ": " + String.join("; ", violations),
                null
            );
        }
    }

    public static List<String> violations(Object value, Map<String, Object> schema) {
        var violations = new ArrayList<String>();
        check(value, normalize(schema), "", violations);
        return violations;
    }

    static Map<String, Object> normalize(Map<String, Object> schema) {
        if (schema == null || schema.isEmpty() || schema.get("type") instanceof String || schema.get("type") instanceof List<?>) {
            return schema == null ? Map.of() : schema;
        }
        if (schema.containsKey("properties") || schema.containsKey("required") || schema.containsKey("enum")) {
            return schema;
        }
        var normalized = new LinkedHashMap<String, Object>();
        normalized.put("type", "object");
        normalized.put("properties", schema);
        return normalized;
    }

    private static void check(Object value, Map<String, Object> schema, String pointer, List<String> violations) {
        var path = pointer.isEmpty() ? "/" : pointer;
        var type = schema.get("type");
        if (type != null && !matchesType(value, type)) {
            violations.add(path + " must be " + describeType(type) + " (got " + typeOf(value) + ")");
            return;
        }
        if (schema.get("enum") instanceof List<?> options && !options.contains(value)) {
            violations.add(path + " must be one of " + options);
        }
        if (value instanceof Number number) {
            if (schema.get("minimum") instanceof Number min && number.doubleValue() < min.doubleValue()) {
                violations.add(path + " must be >= " + min);
            }
            if (schema.get("maximum") instanceof Number max && number.doubleValue() > max.doubleValue()) {
                violations.add(path + " must be <= " + max);
            }
        }
        if (value instanceof Map<?, ?> map) {
            var fields = Values.asMap(map);
            var properties = Values.asMap(schema.get("properties"));
            for (var required : Values.asList(schema.get("required"))) {
                if (required instanceof String key && !fields.containsKey(key)) {
                    violations.add(pointer + "/" + key + " is required");
                }
            }
            for (var entry : fields.entrySet()) {
                var propertySchema = properties.get(entry.getKey());
                if (propertySchema instanceof Map<?, ?> nested) {
                    check(entry.getValue(), Values.asMap(nested), pointer + "/" + entry.getKey(), violations);
                } else if (Boolean.FALSE.equals(schema.get("additionalProperties")) && !properties.containsKey(entry.getKey())) {
                    violations.add(pointer + "/" + entry.getKey() + " is not allowed");
                }
            }
        }
        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < list.size(); i++) {
                check(list.get(i), Values.asMap(items), pointer + "/" + i, violations);
            }
        }
    }

    private static boolean matchesType(Object value, Object type) {
        if (type instanceof List<?> options) {
            return options.stream().anyMatch(option -> matchesType(value, option));
        }
        return switch (String.valueOf(type)) {
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof List<?>;
            case "string" -> value instanceof String;
            case "boolean" -> value instanceof Boolean;
            case "null" -> value == null;
            case "number" -> value instanceof Number;
            case "integer" -> value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue());
            default -> true;
        };
    }

    private static String describeType(Object type) {
        return type instanceof List<?> options ? "one of " + options : String.valueOf(type);
    }

    private static String typeOf(Object value) {
        if (value == null) return "null";
        if (value instanceof Map<?, ?>) return "object";
        if (value instanceof List<?>) return "array";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        return value.getClass().getSimpleName();
    }
}
