package run.telo.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import run.telo.kernel.runtime.Controller;
import run.telo.kernel.runtime.ResourceDefinition;
import run.telo.kernel.runtime.ResourceInstance;
import run.telo.kernel.support.KernelTestSupport;

class TeloRunnerTest {
    @Test
    void runsTheGreeterManifestAndWritesDebugArtifacts(@TempDir Path dir) throws Exception {
        var manifest = KernelTestSupport.fixture("manifests", "greeter", "app.yaml");
        var config = TeloRunConfiguration.builder()
            .manifestTarget(ManifestTarget.forLocal(manifest))
            .workingDirectory(dir)
            .eventStreamFile(Optional.of(Path.of("debug", "events.jsonl")))
            .snapshotFile(Optional.of(Path.of("debug", "snapshot.yaml")))
            .logLevel(LogLevel.INFO)
            .build();

        var result = new TeloRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status(), String.valueOf(result.metadata().get("error")));
        assertEquals(0, result.exitCode());
        assertEquals(manifest.toString(), result.metadata().get("manifest"));
        assertTrue(((Number) result.metadata().get("resources")).intValue() >= 3);
        var snapshot = Files.readString(dir.resolve("debug/snapshot.yaml"));
        assertTrue(snapshot.contains("Hello, ada!"), snapshot);
        var events = Files.readString(dir.resolve("debug/events.jsonl"));
        assertTrue(events.contains("\"event\":\"Runtime.Stopped\""), events);
    }

    @Test
    void embeddedControllersCanRequestAnExitCode(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("jobs.yaml"), "kind: App.Job\nmetadata:\n  name: exit\ncode: 4\n");
        var config = TeloRunConfiguration.builder()
            .manifestTarget(ManifestTarget.parse("jobs.yaml"))
            .workingDirectory(dir)
            .controller(
                ResourceDefinition.of("App.Job", Map.of("type", "object")),
                Controller.builder()
                    .create((resource, context) -> new ResourceInstance() {
                        @Override
                        public void run() {
                            context.requestExit(((Number) resource.get("code")).intValue());
                        }
                    })
                    .build()
            )
            .build();

        var result = new TeloRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(4, result.exitCode());
        assertEquals(4, result.metadata().get("exitCode"));
        assertFalse(result.metadata().containsKey("error"));
    }

    @Test
    void reportsLoadFailures(@TempDir Path dir) {
        var config = TeloRunConfiguration.builder()
            .manifestTarget(ManifestTarget.forLocal(dir.resolve("missing.yaml")))
            .workingDirectory(dir)
            .build();

        var result = new TeloRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.exitCode());
        assertTrue(String.valueOf(result.metadata().get("error")).contains("missing.yaml"), result.metadata().toString());
        assertTrue(new TeloRunner().runToJson(config).contains("\"status\" : \"failure\""));
    }
}
