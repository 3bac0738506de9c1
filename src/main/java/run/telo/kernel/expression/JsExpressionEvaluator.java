package run.telo.kernel.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

/**
 * JavaScript expression evaluator backed by GraalJS. The scope travels as JSON so expressions only ever see
 * plain data, and results come back as {@code Map}/{@code List}/scalar trees.
 *
 * <p>A polyglot context is single-threaded; calls are serialized on this instance.
 */
public final class JsExpressionEvaluator implements ExpressionEvaluator {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int COMPILED_CACHE_SIZE = 256;

    private final Context context;
    private final Value jsonParse;
    private boolean closed;
    private final Map<String, Value> compiled = new LinkedHashMap<>(64, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Value> eldest) {
            return size() > COMPILED_CACHE_SIZE;
        }
    };

    public JsExpressionEvaluator() {
        this.context = Context.newBuilder("js")
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2022")
            .build();
        this.jsonParse = context.eval("js", "JSON").getMember("parse");
    }

    @Override
    public synchronized Object evaluate(String expression, Map<String, Object> scope) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException(String.valueOf(expression), "expression is empty", null);
        }
        String serialized;
        try {
            serialized = JSON.writeValueAsString(scope == null ? Map.of() : scope);
        } catch (JsonProcessingException ex) {
            throw new ExpressionException(expression, "scope is not serializable: " + ex.getOriginalMessage(), ex);
        }
        try {
            Value function = compiled.get(expression);
            if (function == null) {
                function = context.eval("js", wrap(expression));
                compiled.put(expression, function);
            }
            return toJava(function.execute(jsonParse.execute(serialized)));
        } catch (PolyglotException ex) {
            throw new ExpressionException(expression, ex.getMessage(), ex);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        compiled.clear();
        context.close();
    }

    private static String wrap(String expression) {
        return "(function (__scope) { with (__scope) { return (" + expression + "\n); } })";
    }

    private static Object toJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.canExecute()) {
            return value.toString();
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }
}
