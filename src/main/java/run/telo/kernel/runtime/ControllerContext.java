package run.telo.kernel.runtime;

import java.util.Map;

/**
 * Kernel capabilities handed to a controller's {@code register} hook.
 */
public interface ControllerContext {
    /**
     * The kind this context acts for.
     */
    String kind();

    void on(String event, EventHandler handler);

    void once(String event, EventHandler handler);

    void off(String event, EventHandler handler);

    /**
     * Emits {@code event}; a name without a dot is prefixed with {@link #kind()}.
     */
    void emit(String event, Object payload);

    Hold acquireHold(String reason);

    Object evaluate(String expression, Map<String, Object> scope);

    /**
     * Resolves every {@code ${{ }}} interpolation inside {@code value}.
     */
    Object expand(Object value, Map<String, Object> scope);

    void requestExit(int code);
}
