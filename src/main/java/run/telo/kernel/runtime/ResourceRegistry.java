package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Indexes resources by kind and name. Secondary lookups (uri, source, generation depth) serve introspection.
 */
public final class ResourceRegistry {
    private final Map<ResourceId, Resource> resources = new LinkedHashMap<>();
    private final Map<String, Map<String, Resource>> byKind = new LinkedHashMap<>();

    public void register(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        var id = resource.id();
        if (resources.containsKey(id)) {
            throw new KernelException(
                ErrorCode.ERR_DUPLICATE_RESOURCE,
                id,
                "Duplicate resource: " + id + describeOrigin(resources.get(id)),
                null
            );
        }
        resources.put(id, resource);
        byKind.computeIfAbsent(id.kind(), k -> new LinkedHashMap<>()).put(id.name(), resource);
    }

    /**
     * Swaps in a new version of an already registered resource, keeping its registration position.
     */
    public void replace(Resource resource) {
        var id = resource.id();
        if (!resources.containsKey(id)) {
            throw new KernelException(ErrorCode.ERR_RESOURCE_NOT_FOUND, id, "Resource not registered: " + id, null);
        }
        resources.put(id, resource);
        byKind.get(id.kind()).put(id.name(), resource);
    }

    public Optional<Resource> unregister(ResourceId id) {
        var removed = resources.remove(id);
        if (removed != null) {
            var names = byKind.get(id.kind());
            names.remove(id.name());
            if (names.isEmpty()) {
                byKind.remove(id.kind());
            }
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Resource> get(String kind, String name) {
        var names = byKind.get(kind);
        return names == null ? Optional.empty() : Optional.ofNullable(names.get(name));
    }

    public Optional<Resource> get(ResourceId id) {
        return Optional.ofNullable(resources.get(id));
    }

    public boolean contains(ResourceId id) {
        return resources.containsKey(id);
    }

    public List<Resource> getByKind(String kind) {
        var names = byKind.get(kind);
        return names == null ? List.of() : List.copyOf(names.values());
    }

    public Optional<Resource> getByUri(String uri) {
        return resources.values().stream().filter(r -> Objects.equals(uri, r.uri())).findFirst();
    }

    public List<Resource> getBySource(String source) {
        return resources.values().stream().filter(r -> Objects.equals(source, r.source())).toList();
    }

    public List<Resource> getByGenerationDepth(int depth) {
        return resources.values().stream().filter(r -> r.generationDepth() == depth).toList();
    }

    public List<Resource> all() {
        return new ArrayList<>(resources.values());
    }

    public int size() {
        return resources.size();
    }

    private static String describeOrigin(Resource existing) {
        var uri = existing.uri();
        return uri == null ? "" : " (already registered from " + uri + ")";
    }
}
