package run.telo.kernel.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import run.telo.kernel.shared.Values;

/**
 * Resolves {@code ${{ expr }}} interpolations inside strings and value trees.
 *
 * <p>A string that is exactly one interpolation yields the typed result; mixed text yields a string. Expressions
 * rooted at a deferred identifier that the scope does not bind are left untouched.
 */
public final class Interpolator {
    // The body may contain single braces but never the closing "}}".
    private static final String BODY = "((?:(?!\\}\\}).)+?)";
    public static final Pattern INTERPOLATION = Pattern.compile("\\$\\{\\{\\s*" + BODY + "\\s*\\}\\}");
    public static final Pattern EXACT = Pattern.compile("^\\s*\\$\\{\\{\\s*" + BODY + "\\s*\\}\\}\\s*$");
    private static final Pattern ROOT_IDENTIFIER = Pattern.compile("^\\s*([A-Za-z_$][A-Za-z0-9_$]*)");

    private final ExpressionEvaluator evaluator;
    private final Set<String> deferredRoots;

    public Interpolator(ExpressionEvaluator evaluator, Collection<String> deferredRoots) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.deferredRoots = Set.copyOf(deferredRoots);
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public Evaluation evaluate(String expression, Map<String, Object> scope) {
        if (isDeferred(expression, scope)) {
            return Evaluation.deferred();
        }
        try {
            return Evaluation.resolved(evaluator.evaluate(expression, scope));
        } catch (ExpressionException ex) {
            return Evaluation.failed(ex);
        }
    }

    public boolean isDeferred(String expression, Map<String, Object> scope) {
        var root = rootIdentifier(expression);
        return root != null && deferredRoots.contains(root) && !scope.containsKey(root);
    }

    /**
     * @throws ExpressionException on the first failed interpolation
     */
    public Object interpolate(String text, Map<String, Object> scope) {
        if (!hasInterpolation(text)) {
            return text;
        }
        var exact = EXACT.matcher(text);
        if (exact.matches()) {
            var outcome = evaluate(exact.group(1), scope);
            return switch (outcome.status()) {
                case RESOLVED -> outcome.value();
                case DEFERRED -> text;
                case FAILED -> throw outcome.error();
            };
        }
        var matcher = INTERPOLATION.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            var outcome = evaluate(matcher.group(1), scope);
            String replacement = switch (outcome.status()) {
                case RESOLVED -> Values.stringify(outcome.value());
                case DEFERRED -> matcher.group();
                case FAILED -> throw outcome.error();
            };
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Interpolates every string found in {@code value}, returning a new tree.
     */
    public Object expand(Object value, Map<String, Object> scope) {
        if (value instanceof String text) {
            return interpolate(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            var expanded = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> expanded.put(String.valueOf(k), expand(v, scope)));
            return expanded;
        }
        if (value instanceof List<?> list) {
            var expanded = new ArrayList<Object>(list.size());
            for (var item : list) {
                expanded.add(expand(item, scope));
            }
            return expanded;
        }
        return value;
    }

    public static boolean hasInterpolation(String text) {
        return text != null && text.contains("${{") && INTERPOLATION.matcher(text).find();
    }

    /**
     * Collects the expression bodies of every interpolation found in {@code value}.
     */
    public static List<String> expressionsIn(Object value) {
        var found = new ArrayList<String>();
        collect(value, found);
        return found;
    }

    private static void collect(Object value, List<String> found) {
        if (value instanceof String text) {
            var matcher = INTERPOLATION.matcher(text);
            while (matcher.find()) {
                found.add(matcher.group(1));
            }
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collect(v, found));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> collect(v, found));
        }
    }

    static String rootIdentifier(String expression) {
        var matcher = ROOT_IDENTIFIER.matcher(expression);
        return matcher.find() ? matcher.group(1) : null;
    }
}
