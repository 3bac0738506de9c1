package run.telo.kernel.controllers;

import java.util.LinkedHashMap;
import java.util.Map;
import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.KernelException;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceContext;
import run.telo.kernel.runtime.ResourceDefinition;
import run.telo.kernel.runtime.ResourceInstance;

/**
 * {@code Runtime.Definition}: declares a kind once its instance initializes. The controller itself is loaded
 * lazily from the declared entrypoints the first time a resource of that kind is discovered.
 */
final class ResourceDefinitionController {
    private ResourceDefinitionController() {}

    static ResourceInstance create(Resource resource, ResourceContext context) {
        var definition = ResourceDefinition.from(resource);
        if (!(resource.get("schema") == null || resource.get("schema") instanceof Map<?, ?>)) {
            throw new KernelException(
                ErrorCode.ERR_SCHEMA_VALIDATION,
                resource.id(),
                "Definition " + resource.name() + " has a non-object schema",
                null
            );
        }
        return new DefinitionInstance(definition);
    }

    private static final class DefinitionInstance implements ResourceInstance {
        private final ResourceDefinition definition;

        DefinitionInstance(ResourceDefinition definition) {
            this.definition = definition;
        }

        @Override
        public void init(ResourceContext context) {
            context.registerDefinition(definition);
        }

        @Override
        public Map<String, Object> snapshot() {
            var state = new LinkedHashMap<String, Object>();
            state.put("kind", definition.qualifiedKind());
            state.put("entrypoints", definition.entrypoints());
            if (definition.extendsKind() != null) {
                state.put("extends", definition.extendsKind());
            }
            return state;
        }
    }
}
