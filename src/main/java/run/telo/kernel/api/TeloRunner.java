package run.telo.kernel.api;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import run.telo.kernel.controllers.KernelFactory;
import run.telo.kernel.runtime.Kernel;
import run.telo.kernel.runtime.KernelException;

/**
 * Public entry point for embedding the Java kernel.
 */
public final class TeloRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TeloRunner.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);
    private static final List<String> ALL_EVENTS = List.of("*", "*.*", "*.*.*");

    public RunResult run(TeloRunConfiguration configuration) {
        var started = Instant.now();
        LoggingConfigurator.apply(configuration.logLevel());
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("manifest", configuration.manifestTarget().display());

        Thread shutdownHook = null;
        try (var kernel = KernelFactory.create(configuration.settings())) {
            for (var binding : configuration.extraControllers()) {
                kernel.define(binding.definition(), binding.controller());
            }
            if (configuration.logEvents()) {
                for (var pattern : ALL_EVENTS) {
                    kernel.on(pattern, event -> LOG.info("[event] {} {}", event.name(), event.payload()));
                }
            }
            if (configuration.eventStreamFile().isPresent()) {
                kernel.enableEventStream(resolve(configuration, configuration.eventStreamFile().get()));
            }
            var snapshotTaken = new AtomicBoolean();
            configuration.snapshotFile().ifPresent(file ->
                kernel.on(Kernel.STOPPING, event -> writeSnapshot(kernel, resolve(configuration, file), snapshotTaken)));
            if (configuration.installShutdownHook()) {
                shutdownHook = new Thread(() -> awaitShutdown(kernel), "telo-shutdown");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            try {
                kernel.loadFromConfig(configuration.manifestTarget().location(configuration.workingDirectory()));
                int exitCode = kernel.start();
                metadata.put("exitCode", exitCode);
                metadata.put("resources", kernel.registry().size());
                return RunResult.completed(exitCode, metadata, started);
            } finally {
                if (configuration.snapshotFile().isPresent() && !snapshotTaken.get()) {
                    writeSnapshot(kernel, resolve(configuration, configuration.snapshotFile().get()), snapshotTaken);
                }
            }
        } catch (Exception ex) {
            metadata.put("exitCode", RunResult.Status.FAILURE.exitCode());
            var message = KernelException.describe(ex);
            metadata.put("error", message);
            LOG.error("Run of {} failed: {}", configuration.manifestTarget().display(), message);
            if (Boolean.getBoolean("telo.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(message, metadata, started);
        } finally {
            removeShutdownHook(shutdownHook);
        }
    }

    private static void writeSnapshot(Kernel kernel, Path file, AtomicBoolean taken) throws IOException {
        if (taken.compareAndSet(false, true)) {
            kernel.writeSnapshot(file);
        }
    }

    private static void awaitShutdown(Kernel kernel) {
        kernel.shutdown();
        try {
            if (!kernel.awaitTermination(SHUTDOWN_GRACE)) {
                LOG.warn("Kernel did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the kernel to stop");
        }
    }

    private static void removeShutdownHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOG.debug("JVM already shutting down; hook left in place");
        }
    }

    private static Path resolve(TeloRunConfiguration configuration, Path file) {
        return file.isAbsolute() ? file : configuration.workingDirectory().resolve(file);
    }

    /**
     * Runs {@code configuration} and returns the pretty-printed JSON form of its result.
     */
    public String runToJson(TeloRunConfiguration configuration) {
        return run(configuration).toPrettyJson();
    }
}
