package run.telo.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static run.telo.kernel.support.KernelTestSupport.resource;

import java.util.List;
import org.junit.jupiter.api.Test;

final class DependencyOrdererTest {
    @Test
    void placesDefinersAheadOfTheirResources() {
        var server = resource("Server", "main");
        var definition = resource("Runtime.Definition", "Server");
        var other = resource("Logger", "root");

        var ordered = DependencyOrderer.order(List.of(server, definition, other));

        assertEquals(List.of("Runtime.Definition.Server", "Server.main", "Logger.root"), ids(ordered));
    }

    @Test
    void keepsInputOrderWhenThereAreNoDependencies() {
        var a = resource("A", "one");
        var b = resource("B", "two");
        var c = resource("C", "three");

        assertEquals(List.of(a, b, c), DependencyOrderer.order(List.of(a, b, c)));
    }

    @Test
    void matchesModuleQualifiedKinds() {
        var route = resource("Http.Route", "users");
        var definition = resource("Runtime.Definition", "Route").withMetadata(Resource.MODULE, "Http");

        var ordered = DependencyOrderer.order(List.of(route, definition));

        assertEquals(List.of("Runtime.Definition.Route", "Http.Route.users"), ids(ordered));
    }

    @Test
    void reportsCyclesWithTheResourcesInvolved() {
        var a = resource("B", "A");
        var b = resource("A", "B");

        var error = assertThrows(KernelException.class, () -> DependencyOrderer.order(List.of(a, b)));

        assertEquals(ErrorCode.ERR_DEPENDENCY_CYCLE, error.code());
        assertTrue(error.getMessage().contains("B.A"), error.getMessage());
        assertTrue(error.getMessage().contains("A.B"), error.getMessage());
    }

    private static List<String> ids(List<Resource> resources) {
        return resources.stream().map(r -> r.id().toString()).toList();
    }
}
