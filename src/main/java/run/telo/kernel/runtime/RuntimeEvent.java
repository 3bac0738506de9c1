package run.telo.kernel.runtime;

/**
 * An emitted event: its fully-qualified name and an optional payload.
 */
public record RuntimeEvent(String name, Object payload) {}
