package run.telo.kernel.runtime;

/**
 * Entrypoint contract for controllers loaded by class name from a {@code Runtime.Definition}.
 * Implementations need a public no-arg constructor.
 */
@FunctionalInterface
public interface ControllerProvider {
    Controller controller(ResourceDefinition definition);
}
