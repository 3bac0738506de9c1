package run.telo.kernel.runtime;

public enum KernelState {
    CREATED,
    LOADED,
    RESOLVED,
    REGISTERED,
    DISCOVERED,
    RUNNING,
    IDLE,
    STOPPING,
    STOPPED,
    FAILED
}
