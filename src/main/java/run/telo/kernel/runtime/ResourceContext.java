package run.telo.kernel.runtime;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capabilities handed to {@code create}, {@code compile} and {@code init} for one resource.
 */
public interface ResourceContext extends ControllerContext {
    ResourceId resourceId();

    /**
     * Registers a new resource document as a child of this resource.
     */
    void registerManifest(Map<String, Object> document);

    /**
     * Registers documents together, so instances may use templates declared in the same batch.
     */
    void registerManifests(List<Map<String, Object>> documents);

    void registerDefinition(ResourceDefinition definition);

    void registerController(String kind, Controller controller);

    Object invoke(String kind, String name, Object input);

    Object execute(String urn, Object input);

    Optional<ResourceInstance> getInstance(String kind, String name);

    List<ResourceInstance> getInstances(String kind);

    /**
     * Emits a custom event on behalf of this resource.
     */
    void emitEvent(String event, Object payload);

    void validate(Object value, Map<String, Object> schema);

    ManifestLoader manifestLoader();
}
