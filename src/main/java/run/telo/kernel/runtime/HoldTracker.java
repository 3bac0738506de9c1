package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Reference count of outstanding holds. Holds may be released from any thread. Transition callbacks are
 * serialized on their own lock so Blocked and Unblocked alternate; idle completions run outside both locks.
 */
public final class HoldTracker {
    public static final String BLOCKED = "Runtime.Blocked";
    public static final String UNBLOCKED = "Runtime.Unblocked";

    private final BiConsumer<String, Map<String, Object>> transitions;
    private final Object transitionLock = new Object();
    private int count;
    private List<CompletableFuture<Void>> waiters = new ArrayList<>();

    /**
     * @param transitions receives {@link #BLOCKED} on 0 to 1 and {@link #UNBLOCKED} on 1 to 0
     */
    public HoldTracker(BiConsumer<String, Map<String, Object>> transitions) {
        this.transitions = transitions;
    }

    public Hold acquire(String reason) {
        synchronized (transitionLock) {
            int current;
            synchronized (this) {
                current = ++count;
            }
            if (current == 1) {
                transitions.accept(BLOCKED, payload(reason, current));
            }
        }
        return new Lease(reason);
    }

    public synchronized int count() {
        return count;
    }

    public synchronized CompletableFuture<Void> waitForIdle() {
        if (count == 0) {
            return CompletableFuture.completedFuture(null);
        }
        var waiter = new CompletableFuture<Void>();
        waiters.add(waiter);
        return waiter;
    }

    /**
     * Completes every pending idle wait regardless of outstanding holds.
     */
    public void releaseWaiters() {
        List<CompletableFuture<Void>> pending;
        synchronized (this) {
            pending = waiters;
            waiters = new ArrayList<>();
        }
        pending.forEach(waiter -> waiter.complete(null));
    }

    private void release(String reason) {
        List<CompletableFuture<Void>> pending = List.of();
        try {
            synchronized (transitionLock) {
                int current;
                synchronized (this) {
                    current = --count;
                    if (current == 0) {
                        pending = waiters;
                        waiters = new ArrayList<>();
                    }
                }
                if (current == 0) {
                    transitions.accept(UNBLOCKED, payload(reason, current));
                }
            }
        } finally {
            pending.forEach(waiter -> waiter.complete(null));
        }
    }

    private static Map<String, Object> payload(String reason, int count) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reason", reason);
        payload.put("count", count);
        return payload;
    }

    private final class Lease implements Hold {
        private final String reason;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String reason) {
            this.reason = reason;
        }

        @Override
        public String reason() {
            return reason;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                HoldTracker.this.release(reason);
            }
        }

        @Override
        public boolean isReleased() {
            return released.get();
        }
    }
}
