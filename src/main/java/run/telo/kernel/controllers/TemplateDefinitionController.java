package run.telo.kernel.controllers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceContext;
import run.telo.kernel.runtime.ResourceInstance;
import run.telo.kernel.template.TemplateDefinition;

/**
 * Templates are expanded before discovery; the registered definition only backs a passive instance.
 */
final class TemplateDefinitionController {
    private TemplateDefinitionController() {}

    static ResourceInstance create(Resource resource, ResourceContext context) {
        var template = TemplateDefinition.from(resource);
        return new ResourceInstance() {
            @Override
            public Map<String, Object> snapshot() {
                var state = new LinkedHashMap<String, Object>();
                state.put("parameters", new ArrayList<>(template.parameters().keySet()));
                state.put("required", template.required());
                state.put("blueprints", template.blueprints().size());
                return state;
            }
        };
    }
}
