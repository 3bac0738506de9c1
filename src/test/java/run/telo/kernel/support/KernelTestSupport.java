package run.telo.kernel.support;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.controllers.KernelFactory;
import run.telo.kernel.runtime.Controller;
import run.telo.kernel.runtime.Kernel;
import run.telo.kernel.runtime.Resource;
import run.telo.kernel.runtime.ResourceContext;
import run.telo.kernel.runtime.ResourceDefinition;
import run.telo.kernel.runtime.ResourceInstance;

/**
 * Shared helpers for kernel test suites: manifest builders and a controller that records every lifecycle call.
 */
public final class KernelTestSupport {
    public static final Map<String, Object> OBJECT_SCHEMA = Map.of("type", "object");

    private KernelTestSupport() {}

    public static Kernel kernel() {
        return KernelFactory.create(KernelSettings.defaults());
    }

    public static Kernel kernel(KernelSettings settings) {
        return KernelFactory.create(settings);
    }

    public static Path fixture(String... segments) {
        return Path.of("src/test/resources", segments).toAbsolutePath();
    }

    /**
     * Builds a manifest document; {@code fields} alternates keys and values.
     */
    public static Map<String, Object> manifest(String kind, String name, Object... fields) {
        if (fields.length % 2 != 0) {
            throw new IllegalArgumentException("fields must come in key/value pairs");
        }
        var document = new LinkedHashMap<String, Object>();
        document.put("kind", kind);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("name", name);
        document.put("metadata", metadata);
        for (int i = 0; i < fields.length; i += 2) {
            document.put((String) fields[i], fields[i + 1]);
        }
        return document;
    }

    public static Resource resource(String kind, String name, Object... fields) {
        return Resource.of(manifest(kind, name, fields));
    }

    public static void define(Kernel kernel, String kind, Controller controller) {
        kernel.define(ResourceDefinition.of(kind, OBJECT_SCHEMA), controller);
    }

    /**
     * Records {@code phase:Name} entries for every lifecycle hook of the instances it creates.
     */
    public static final class Recorder {
        private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        public Controller controller() {
            return Controller.builder()
                .schema(OBJECT_SCHEMA)
                .create((resource, context) -> {
                    calls.add("create:" + resource.name());
                    return new RecordingInstance(resource);
                })
                .build();
        }

        public List<String> calls() {
            return List.copyOf(calls);
        }

        public List<String> calls(String phase) {
            return calls().stream().filter(call -> call.startsWith(phase + ":")).map(call -> call.substring(phase.length() + 1)).toList();
        }

        private final class RecordingInstance implements ResourceInstance {
            private final Resource resource;

            RecordingInstance(Resource resource) {
                this.resource = resource;
            }

            @Override
            public void init(ResourceContext context) {
                calls.add("init:" + resource.name());
            }

            @Override
            public void run() {
                calls.add("run:" + resource.name());
            }

            @Override
            public Object invoke(Object input) {
                calls.add("invoke:" + resource.name());
                return Map.of("echo", input);
            }

            @Override
            public void teardown() {
                calls.add("teardown:" + resource.name());
            }

            @Override
            public Map<String, Object> snapshot() {
                return Map.of("fields", resource.fields());
            }
        }
    }
}
