package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * In-process publish/subscribe. Subscriptions may use {@code *} for any single name segment.
 *
 * <p>Emission calls every matching handler, then fails if any of them failed: the first failure becomes the
 * cause and the others are attached as suppressed exceptions.
 */
public final class EventBus {
    private static final Pattern EVENT_NAME =
        Pattern.compile("^(\\*|[A-Za-z_][A-Za-z0-9_]*)(\\.(\\*|[A-Za-z_][A-Za-z0-9_]*))*$");

    private final Map<String, Set<EventHandler>> handlers = new ConcurrentHashMap<>();

    public void on(String event, EventHandler handler) {
        validate(event);
        handlers.computeIfAbsent(event, e -> ConcurrentHashMap.newKeySet()).add(handler);
    }

    public void once(String event, EventHandler handler) {
        validate(event);
        handlers.computeIfAbsent(event, e -> ConcurrentHashMap.newKeySet()).add(new OnceHandler(event, handler));
    }

    public void off(String event, EventHandler handler) {
        var registered = handlers.get(event);
        if (registered == null) {
            return;
        }
        registered.removeIf(h -> h == handler || (h instanceof OnceHandler once && once.delegate == handler));
    }

    public boolean hasHandlers(String event) {
        return handlers.entrySet().stream().anyMatch(e -> !e.getValue().isEmpty() && matches(e.getKey(), event));
    }

    public void emit(String event, Object payload) {
        validate(event);
        if (event.contains("*")) {
            throw new KernelException(ErrorCode.ERR_INVALID_EVENT, "Cannot emit a wildcard event: " + event);
        }
        var targets = new ArrayList<EventHandler>();
        handlers.forEach((pattern, registered) -> {
            if (matches(pattern, event)) {
                targets.addAll(registered);
            }
        });
        var runtimeEvent = new RuntimeEvent(event, payload);
        List<Exception> failures = new ArrayList<>();
        for (var handler : targets) {
            try {
                handler.handle(runtimeEvent);
            } catch (Exception ex) {
                failures.add(ex);
            }
        }
        if (!failures.isEmpty()) {
            var first = failures.get(0);
            var error = new KernelException(
                ErrorCode.ERR_EVENT_HANDLER_FAILED,
                failures.size() + " handler(s) failed for event " + event + ": " + KernelException.describe(first),
                first
            );
            failures.subList(1, failures.size()).forEach(error::addSuppressed);
            throw error;
        }
    }

    static void validate(String event) {
        if (event == null || !EVENT_NAME.matcher(event).matches()) {
            throw new KernelException(ErrorCode.ERR_INVALID_EVENT, "Invalid event name: " + event);
        }
    }

    static boolean matches(String pattern, String event) {
        if (pattern.equals(event)) {
            return true;
        }
        if (!pattern.contains("*")) {
            return false;
        }
        var expected = pattern.split("\\.");
        var actual = event.split("\\.");
        if (expected.length != actual.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (!"*".equals(expected[i]) && !expected[i].equals(actual[i])) {
                return false;
            }
        }
        return true;
    }

    private final class OnceHandler implements EventHandler {
        private final String event;
        private final EventHandler delegate;
        private final AtomicBoolean fired = new AtomicBoolean();

        private OnceHandler(String event, EventHandler delegate) {
            this.event = event;
            this.delegate = delegate;
        }

        @Override
        public void handle(RuntimeEvent runtimeEvent) throws Exception {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            var registered = handlers.get(event);
            if (registered != null) {
                registered.remove(this);
            }
            delegate.handle(runtimeEvent);
        }
    }
}
