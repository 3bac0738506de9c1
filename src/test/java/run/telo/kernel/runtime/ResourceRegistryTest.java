package run.telo.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static run.telo.kernel.support.KernelTestSupport.resource;

import java.util.List;
import org.junit.jupiter.api.Test;

final class ResourceRegistryTest {
    @Test
    void rejectsDuplicatesAndKeepsTheFirstRegistration() {
        var registry = new ResourceRegistry();
        registry.register(resource("Http.Server", "main", "port", 8080));

        var error = assertThrows(
            KernelException.class,
            () -> registry.register(resource("Http.Server", "main", "port", 9090))
        );

        assertEquals(ErrorCode.ERR_DUPLICATE_RESOURCE, error.code());
        assertEquals(new ResourceId("Http.Server", "main"), error.resource().orElseThrow());
        assertEquals(8080, registry.get("Http.Server", "main").orElseThrow().get("port"));
    }

    @Test
    void indexesByKindUriSourceAndDepth() {
        var registry = new ResourceRegistry();
        var first = resource("Job", "a").withMetadata(Resource.SOURCE, "/m/app.yaml").withMetadata(Resource.URI, "u#Job.a");
        var second = resource("Job", "b").withMetadata(Resource.GENERATION_DEPTH, 1);
        var other = resource("Queue", "q").withMetadata(Resource.SOURCE, "/m/app.yaml");
        registry.register(first);
        registry.register(second);
        registry.register(other);

        assertEquals(List.of(first, second), registry.getByKind("Job"));
        assertEquals(first, registry.getByUri("u#Job.a").orElseThrow());
        assertEquals(List.of(first, other), registry.getBySource("/m/app.yaml"));
        assertEquals(List.of(second), registry.getByGenerationDepth(1));
        assertEquals(3, registry.size());
    }

    @Test
    void unregisterRemovesEveryIndex() {
        var registry = new ResourceRegistry();
        var job = resource("Job", "a");
        registry.register(job);

        assertEquals(job, registry.unregister(job.id()).orElseThrow());
        assertFalse(registry.contains(job.id()));
        assertTrue(registry.getByKind("Job").isEmpty());
        assertTrue(registry.unregister(job.id()).isEmpty());
    }

    @Test
    void replaceRequiresAnExistingRegistration() {
        var registry = new ResourceRegistry();
        var error = assertThrows(KernelException.class, () -> registry.replace(resource("Job", "ghost")));
        assertEquals(ErrorCode.ERR_RESOURCE_NOT_FOUND, error.code());
    }
}
