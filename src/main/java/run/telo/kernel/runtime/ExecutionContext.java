package run.telo.kernel.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Context passed to {@link Controller.Executor}. Nested calls made through {@link #call(String, Object)} get a
 * child context with the same shape, one level deeper, sharing the attributes.
 */
public final class ExecutionContext {
    private final Kernel kernel;
    private final Resource resource;
    private final int depth;
    private final Map<String, Object> attributes;

    ExecutionContext(Kernel kernel, Resource resource, int depth, Map<String, Object> attributes) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.depth = depth;
        this.attributes = attributes != null ? attributes : new ConcurrentHashMap<>();
    }

    public Resource resource() {
        return resource;
    }

    public int depth() {
        return depth;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public Object call(String urn, Object input) {
        return kernel.execute(urn, input, this);
    }

    public Object evaluate(String expression, Map<String, Object> scope) {
        return kernel.evaluate(expression, scope);
    }

    ExecutionContext child(Resource target) {
        return new ExecutionContext(kernel, target, depth + 1, attributes);
    }
}
