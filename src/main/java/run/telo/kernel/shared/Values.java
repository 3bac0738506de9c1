package run.telo.kernel.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed {@code Map}/{@code List} trees that manifests are parsed into.
 */
public final class Values {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Values() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return List.of();
    }

    public static String asString(Object value) {
        return value instanceof String str ? str : null;
    }

    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> copyMap(Map<String, ?> value) {
        var copy = new LinkedHashMap<String, Object>();
        if (value != null) {
            value.forEach((k, v) -> copy.put(k, deepCopy(v)));
        }
        return copy;
    }

    /**
     * JavaScript truthiness: {@code null}, {@code false}, zero, {@code NaN} and the empty string are falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0d && !Double.isNaN(d);
        }
        if (value instanceof String str) {
            return !str.isEmpty();
        }
        return true;
    }

    /**
     * Renders a value for string interpolation. Structures are written as JSON.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString(d.longValue());
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Unable to stringify value: " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }
}
