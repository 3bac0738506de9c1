package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import run.telo.kernel.shared.Values;

/**
 * Declares a kind: its schema, the controller entrypoints able to serve it and an optional parent kind.
 */
public record ResourceDefinition(
    String name,
    String module,
    String resourceKind,
    Map<String, Object> schema,
    List<String> entrypoints,
    String extendsKind
) {
    public static final String KIND = "Runtime.Definition";
    private static final String JAVA_RUNTIME = "java";
    private static final String JAVA_PREFIX = "java:";

    public ResourceDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resourceKind, "resourceKind");
        schema = schema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        entrypoints = entrypoints == null ? List.of() : List.copyOf(entrypoints);
    }

    public static ResourceDefinition of(String kind, Map<String, Object> schema) {
        int dot = kind.lastIndexOf('.');
        var module = dot > 0 ? kind.substring(0, dot) : null;
        var name = dot > 0 ? kind.substring(dot + 1) : kind;
        return new ResourceDefinition(name, module, kind, schema, List.of(), null);
    }

    public static ResourceDefinition from(Resource resource) {
        if (!KIND.equals(resource.kind())) {
            throw new KernelException(
                ErrorCode.ERR_INVALID_RESOURCE,
                resource.id(),
                "Expected a " + KIND + " resource but got " + resource.id(),
                null
            );
        }
        var metadata = resource.metadata();
        var resourceKind = Values.asString(metadata.get("resourceKind"));
        var parent = Values.asString(resource.get("extends"));
        return new ResourceDefinition(
            resource.name(),
            resource.module(),
            resourceKind == null || resourceKind.isBlank() ? resource.name() : resourceKind,
            Values.asMap(resource.get("schema")),
            javaEntrypoints(resource),
            parent == null || parent.isBlank() ? null : parent
        );
    }

    /**
     * {@code module.resourceKind}, unless the resource kind is already qualified.
     */
    public String qualifiedKind() {
        if (module == null || module.isBlank() || resourceKind.contains(".")) {
            return resourceKind;
        }
        return module + "." + resourceKind;
    }

    private static List<String> javaEntrypoints(Resource resource) {
        var entrypoints = new ArrayList<String>();
        for (var entry : Values.asList(resource.get("controllers"))) {
            if (entry instanceof String text) {
                if (text.startsWith(JAVA_PREFIX)) {
                    entrypoints.add(text.substring(JAVA_PREFIX.length()));
                } else if (!text.contains(":")) {
                    entrypoints.add(text);
                }
            } else if (entry instanceof Map<?, ?> map) {
                var fields = Values.asMap(map);
                var runtime = Values.asString(fields.get("runtime"));
                var entrypoint = Values.asString(fields.get("entrypoint"));
                if (entrypoint != null && (runtime == null || JAVA_RUNTIME.equals(runtime))) {
                    entrypoints.add(entrypoint);
                }
            }
        }
        return entrypoints;
    }
}
