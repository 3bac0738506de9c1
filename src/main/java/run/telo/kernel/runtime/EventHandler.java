package run.telo.kernel.runtime;

@FunctionalInterface
public interface EventHandler {
    void handle(RuntimeEvent event) throws Exception;
}
