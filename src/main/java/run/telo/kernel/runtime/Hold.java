package run.telo.kernel.runtime;

/**
 * Keepalive lease returned by {@link Kernel#acquireHold(String)}. Releasing more than once has no effect.
 */
public interface Hold extends AutoCloseable {
    String reason();

    void release();

    boolean isReleased();

    @Override
    default void close() {
        release();
    }
}
