package run.telo.kernel.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.shared.Values;

/**
 * Parsed {@code TemplateDefinition} resource: parameter declarations plus an ordered list of blueprints.
 */
public record TemplateDefinition(
    String name,
    String module,
    Map<String, Object> parameters,
    List<String> required,
    List<Map<String, Object>> blueprints
) {
    public static final String KIND = "TemplateDefinition";
    public static final String SCHEMA = "schema";
    public static final String RESOURCES = "resources";

    public TemplateDefinition {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        required = List.copyOf(required);
        blueprints = List.copyOf(blueprints);
    }

    public static boolean isTemplate(Resource resource) {
        return KIND.equals(resource.kind());
    }

    public static TemplateDefinition from(Resource resource) {
        if (!isTemplate(resource)) {
            throw new IllegalArgumentException("Not a template definition: " + resource.id());
        }
        var schema = Values.asMap(resource.get(SCHEMA));
        var parameters = new LinkedHashMap<String, Object>();
        var required = new LinkedHashSet<String>();
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            Values.asMap(properties).forEach(parameters::put);
            for (var entry : Values.asList(schema.get("required"))) {
                if (entry instanceof String param) {
                    required.add(param);
                }
            }
        } else if (!(schema.get("type") instanceof String)) {
            schema.forEach(parameters::put);
        }
        parameters.forEach((param, declaration) -> {
            if (Boolean.TRUE.equals(Values.asMap(declaration).get("required"))) {
                required.add(param);
            }
        });

        var blueprints = new ArrayList<Map<String, Object>>();
        var raw = Values.asList(resource.get(RESOURCES));
        for (int i = 0; i < raw.size(); i++) {
            if (!(raw.get(i) instanceof Map<?, ?> blueprint)) {
                throw new TemplateException(
                    TemplateException.Reason.INVALID_BLUEPRINT,
                    resource.name(),
                    resource.generationDepth(),
                    "blueprint #" + i + " is not a mapping"
                );
            }
            blueprints.add(Values.copyMap(Values.asMap(blueprint)));
        }
        return new TemplateDefinition(
            resource.name(),
            resource.module(),
            parameters,
            new ArrayList<>(required),
            blueprints
        );
    }

    /**
     * Default values declared by {@code schema.properties.*.default}.
     */
    public Map<String, Object> defaults() {
        var defaults = new LinkedHashMap<String, Object>();
        parameters.forEach((param, declaration) -> {
            var fields = Values.asMap(declaration);
            if (fields.containsKey("default")) {
                defaults.put(param, Values.deepCopy(fields.get("default")));
            }
        });
        return defaults;
    }

    /**
     * Whether a resource of {@code kind} instantiates this template (plain or module-qualified name).
     */
    public boolean instantiatedBy(String kind) {
        return name.equals(kind) || (module != null && kind.equals(module + "." + name));
    }
}
