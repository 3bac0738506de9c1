package run.telo.kernel.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One parsed {@code for} clause: {@code "x in expr"} or {@code "k, v in expr"}.
 */
public record ForDirective(String first, String second, String collection) {
    private static final Pattern SYNTAX = Pattern.compile("^\\s*(\\w+)(?:\\s*,\\s*(\\w+))?\\s+in\\s+(.+)$");

    /**
     * @return the directive, or empty when {@code raw} does not follow the loop grammar
     */
    public static Optional<ForDirective> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var matcher = SYNTAX.matcher(raw);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ForDirective(matcher.group(1), matcher.group(2), matcher.group(3).trim()));
    }

    public boolean twoVariables() {
        return second != null;
    }

    /**
     * Variable bindings for every iteration over {@code target}, or {@code null} when the target is not iterable.
     * Arrays bind the element (or index then element); maps bind the key (or key then value).
     */
    public List<Map<String, Object>> bindings(Object target) {
        var bindings = new ArrayList<Map<String, Object>>();
        if (target == null) {
            return bindings;
        }
        if (target instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                var binding = new LinkedHashMap<String, Object>();
                if (twoVariables()) {
                    binding.put(first, i);
                    binding.put(second, list.get(i));
                } else {
                    binding.put(first, list.get(i));
                }
                bindings.add(binding);
            }
            return bindings;
        }
        if (target instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                var binding = new LinkedHashMap<String, Object>();
                binding.put(first, String.valueOf(entry.getKey()));
                if (twoVariables()) {
                    binding.put(second, entry.getValue());
                }
                bindings.add(binding);
            }
            return bindings;
        }
        return null;
    }
}
