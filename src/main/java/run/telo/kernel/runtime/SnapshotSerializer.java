package run.telo.kernel.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Point-in-time dump of the registry and of live instance state, ordered by generation depth.
 */
public final class SnapshotSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotSerializer.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private SnapshotSerializer() {}

    /**
     * @param instances live instance lookup; returns {@code null} for resources without one
     */
    public static Map<String, Object> capture(ResourceRegistry registry, Function<ResourceId, ResourceInstance> instances) {
        var ordered = new ArrayList<>(registry.all());
        ordered.sort(Comparator.comparingInt(Resource::generationDepth));
        List<Map<String, Object>> entries = new ArrayList<>();
        for (var resource : ordered) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("kind", resource.kind());
            entry.put("name", resource.name());
            entry.put("metadata", resource.toMap().get(Resource.METADATA));
            entry.put("data", resource.fields());
            var instance = instances.apply(resource.id());
            if (instance != null) {
                try {
                    var state = instance.snapshot();
                    if (state != null) {
                        entry.put("snapshot", state);
                    }
                } catch (RuntimeException ex) {
                    LOG.warn("Snapshot of {} failed and was omitted: {}", resource.id(), KernelException.describe(ex));
                }
            }
            entries.add(entry);
        }
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("timestamp", Instant.now().toString());
        snapshot.put("resources", entries);
        return snapshot;
    }

    public static String toYaml(Map<String, Object> snapshot) {
        try {
            return YAML_MAPPER.writeValueAsString(snapshot);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to serialize snapshot: " + ex.getMessage(), ex);
        }
    }

    public static void write(Map<String, Object> snapshot, Path file) throws IOException {
        var target = file.toAbsolutePath().normalize();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, toYaml(snapshot));
        LOG.info("Wrote snapshot of {} resource(s) to {}", ((List<?>) snapshot.get("resources")).size(), target);
    }
}
