package run.telo.kernel.runtime;

import java.util.Map;

/**
 * Live object created by a controller for one resource. Every lifecycle hook is optional.
 */
public interface ResourceInstance {
    default void init(ResourceContext context) throws Exception {}

    default void run() throws Exception {}

    default Object invoke(Object input) throws Exception {
        throw new KernelException(ErrorCode.ERR_RESOURCE_NOT_INVOKABLE, "Resource does not support invoke");
    }

    default void teardown() throws Exception {}

    /**
     * Point-in-time state for debug snapshots, or {@code null}.
     */
    default Map<String, Object> snapshot() {
        return null;
    }
}
