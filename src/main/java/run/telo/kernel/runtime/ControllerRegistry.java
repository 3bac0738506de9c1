package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps fully-qualified kinds to their definition and controller.
 *
 * <p>A controller comes from an explicit registration, from the Java entrypoint of the kind's definition (loaded
 * on first lookup), or from the nearest ancestor of an {@code extends} chain.
 */
public final class ControllerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ControllerRegistry.class);

    private final Map<String, ResourceDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, Controller> controllers = new LinkedHashMap<>();
    private final ControllerLoader loader;

    public ControllerRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ControllerRegistry(ClassLoader classLoader) {
        this.loader = new ControllerLoader(classLoader != null ? classLoader : ControllerRegistry.class.getClassLoader());
    }

    public void registerDefinition(ResourceDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        var kind = definition.qualifiedKind();
        var previous = definitions.putIfAbsent(kind, definition);
        if (previous != null && !previous.equals(definition)) {
            throw new KernelException(ErrorCode.ERR_CONTROLLER_INVALID, "Kind " + kind + " is already defined");
        }
        LOG.debug("Registered definition for {}", kind);
    }

    /**
     * Binds {@code controller} to a defined kind. A controller without a schema takes the definition's.
     */
    public void registerController(String kind, Controller controller) {
        Objects.requireNonNull(controller, "controller");
        var definition = definitions.get(kind);
        if (definition == null) {
            throw new KernelException(
                ErrorCode.ERR_CONTROLLER_INVALID,
                "Cannot register controller for kind " + kind + " without definition"
            );
        }
        if (controllers.containsKey(kind)) {
            throw new KernelException(ErrorCode.ERR_CONTROLLER_INVALID, "Kind " + kind + " already has a controller");
        }
        controllers.put(kind, adopt(controller, definition));
        LOG.debug("Registered controller for {}", kind);
    }

    public void register(ResourceDefinition definition, Controller controller) {
        registerDefinition(definition);
        registerController(definition.qualifiedKind(), controller);
    }

    /**
     * Controller for {@code kind}, loading a declared entrypoint or inheriting from a parent kind when needed.
     *
     * @throws KernelException when a declared entrypoint cannot be loaded
     */
    public Optional<Controller> find(String kind) {
        var controller = controllers.get(kind);
        if (controller != null) {
            return Optional.of(controller);
        }
        var definition = definitions.get(kind);
        if (definition == null) {
            return Optional.empty();
        }
        if (!definition.entrypoints().isEmpty()) {
            var loaded = adopt(loader.load(definition), definition);
            controllers.put(kind, loaded);
            return Optional.of(loaded);
        }
        return inherit(kind, definition);
    }

    public Optional<ResourceDefinition> definition(String kind) {
        return Optional.ofNullable(definitions.get(kind));
    }

    public boolean isDefined(String kind) {
        return definitions.containsKey(kind);
    }

    public List<String> definedKinds() {
        return new ArrayList<>(definitions.keySet());
    }

    public List<String> controlledKinds() {
        return new ArrayList<>(controllers.keySet());
    }

    private Optional<Controller> inherit(String kind, ResourceDefinition definition) {
        var visited = new LinkedHashSet<String>();
        visited.add(kind);
        var parent = definition.extendsKind();
        while (parent != null) {
            if (!visited.add(parent)) {
                throw new KernelException(
                    ErrorCode.ERR_CONTROLLER_INVALID,
                    "Kind inheritance cycle: " + String.join(" -> ", visited) + " -> " + parent
                );
            }
            var parentController = controllers.get(parent);
            var parentDefinition = definitions.get(parent);
            if (parentController == null && parentDefinition != null && !parentDefinition.entrypoints().isEmpty()) {
                parentController = find(parent).orElse(null);
            }
            if (parentController != null) {
                var inherited = definition.schema().isEmpty() ? parentController : parentController.withSchema(definition.schema());
                controllers.put(kind, inherited);
                LOG.debug("Kind {} inherits the controller of {}", kind, parent);
                return Optional.of(inherited);
            }
            parent = parentDefinition == null ? null : parentDefinition.extendsKind();
        }
        return Optional.empty();
    }

    private static Controller adopt(Controller controller, ResourceDefinition definition) {
        if (controller.hasSchema() || definition.schema().isEmpty()) {
            return controller;
        }
        return controller.withSchema(definition.schema());
    }
}
