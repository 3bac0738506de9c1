package run.telo.kernel.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static run.telo.kernel.support.KernelTestSupport.manifest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import run.telo.kernel.runtime.ErrorCode;
import run.telo.kernel.runtime.Kernel;
import run.telo.kernel.runtime.KernelException;
import run.telo.kernel.runtime.ResourceId;
import run.telo.kernel.support.GreeterControllerProvider.Greeter;
import run.telo.kernel.support.KernelTestSupport;

final class BuiltinControllersTest {
    private final Kernel kernel = KernelTestSupport.kernel();

    @AfterEach
    void closeKernel() {
        kernel.close();
    }

    @Test
    void bootsTheGreeterManifest() {
        kernel.loadFromConfig(KernelTestSupport.fixture("manifests", "greeter", "app.yaml").toString());

        kernel.boot();

        assertEquals("Hello, ada!", greeting("ada"));
        assertEquals("Hello, linus!", greeting("linus"));
        assertEquals("Served by Hello, ada!", greeting("host"));
        assertEquals("Hello, linus! / hi", kernel.execute("demo.Greeter.linus", "hi"));
        assertEquals("Hello, ada!", kernel.invoke("demo.Greeter", "ada", null));
        assertTrue(kernel.registry().get("GreeterSet", "team").isEmpty());
        assertTrue(kernel.instance("Runtime.Module", "demo").isEmpty());
    }

    @Test
    void templateDefinitionsStayInspectable() {
        kernel.loadFromConfig(KernelTestSupport.fixture("manifests", "greeter", "app.yaml").toString());
        kernel.boot();

        var state = kernel.instance("TemplateDefinition", "GreeterSet").orElseThrow().snapshot();

        assertEquals(Map.of("parameters", List.of("names", "prefix"), "required", List.of(), "blueprints", 1), state);
    }

    @Test
    void definitionsRegisterTheirKindOnInit() {
        kernel.loadResources(List.of(
            manifest(
                "Runtime.Definition",
                "Greeter",
                "schema", Map.of("type", "object"),
                "controllers", List.of("java:run.telo.kernel.support.GreeterControllerProvider")
            ),
            manifest("Greeter", "solo", "greeting", "hey")
        ));

        kernel.boot();

        assertEquals("hey", kernel.invoke("Greeter", "solo", null));
        assertEquals(
            Map.of("kind", "Greeter", "entrypoints", List.of("run.telo.kernel.support.GreeterControllerProvider")),
            kernel.instance("Runtime.Definition", "Greeter").orElseThrow().snapshot()
        );
    }

    @Test
    void definitionsNeedAnObjectSchema() {
        kernel.loadResources(List.of(manifest("Runtime.Definition", "Broken", "schema", "not a schema")));

        var error = assertThrows(KernelException.class, kernel::boot);

        assertInstanceOf(KernelException.class, error.getCause());
        assertEquals(ErrorCode.ERR_SCHEMA_VALIDATION, ((KernelException) error.getCause()).code());
    }

    @Test
    void modulesImportManifestsRelativeToTheirOwnFile(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("defs"));
        Files.writeString(dir.resolve("main.yaml"), String.join("\n",
            "kind: Runtime.Module",
            "metadata:",
            "  name: shop",
            "imports:",
            "  - defs/greeter.yaml",
            "resources:",
            "  - path: staff.yaml",
            ""
        ));
        Files.writeString(dir.resolve("defs/greeter.yaml"), String.join("\n",
            "kind: Runtime.Definition",
            "metadata:",
            "  name: Greeter",
            "schema:",
            "  type: object",
            "controllers:",
            "  - java:run.telo.kernel.support.GreeterControllerProvider",
            ""
        ));
        Files.writeString(dir.resolve("staff.yaml"), String.join("\n",
            "kind: shop.Greeter",
            "metadata:",
            "  name: clerk",
            "greeting: Welcome",
            ""
        ));

        kernel.loadFromConfig(dir.resolve("main.yaml").toString());
        kernel.boot();

        assertEquals("Welcome", kernel.invoke("shop.Greeter", "clerk", null));
        var clerk = kernel.registry().get("shop.Greeter", "clerk").orElseThrow();
        assertEquals("shop", clerk.module());
        assertEquals(dir.resolve("staff.yaml").toAbsolutePath().normalize().toString(), clerk.source());
        assertEquals(
            List.of(new ResourceId("Runtime.Definition", "Greeter"), clerk.id()),
            kernel.childrenOf(new ResourceId("Runtime.Module", "shop"))
        );
    }

    @Test
    void missingModuleImportsNameTheModule(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("main.yaml"), "kind: Runtime.Module\nmetadata:\n  name: shop\nimports:\n  - nowhere.yaml\n");
        kernel.loadFromConfig(dir.resolve("main.yaml").toString());

        var error = assertThrows(KernelException.class, kernel::boot);

        assertTrue(error.getMessage().contains("Failed to process Module \"shop\""), error.getMessage());
        assertEquals(ErrorCode.ERR_MANIFEST_LOAD, ((KernelException) error.getCause()).code());
    }

    private String greeting(String name) {
        var instance = kernel.instance("demo.Greeter", name).orElseThrow();
        return assertInstanceOf(Greeter.class, instance).greeting();
    }
}
