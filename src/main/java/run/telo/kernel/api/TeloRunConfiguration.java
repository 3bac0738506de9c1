package run.telo.kernel.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.runtime.Controller;
import run.telo.kernel.runtime.ResourceDefinition;

/**
 * Immutable configuration passed to the Java kernel when running a manifest.
 */
public record TeloRunConfiguration(
    ManifestTarget manifestTarget,
    Path workingDirectory,
    KernelSettings settings,
    Optional<Path> eventStreamFile,
    Optional<Path> snapshotFile,
    LogLevel logLevel,
    List<ControllerBinding> extraControllers,
    boolean logEvents,
    boolean installShutdownHook
) {
    public TeloRunConfiguration {
        Objects.requireNonNull(manifestTarget, "manifestTarget");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(eventStreamFile, "eventStreamFile");
        Objects.requireNonNull(snapshotFile, "snapshotFile");
        Objects.requireNonNull(logLevel, "logLevel");
        extraControllers = List.copyOf(extraControllers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A kind contributed by the embedding application.
     */
    public record ControllerBinding(ResourceDefinition definition, Controller controller) {
        public ControllerBinding {
            Objects.requireNonNull(definition, "definition");
            Objects.requireNonNull(controller, "controller");
        }

        public String kind() {
            return definition.qualifiedKind();
        }
    }

    public static final class Builder {
        private ManifestTarget manifestTarget;
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private KernelSettings settings = KernelSettings.defaults();
        private Optional<Path> eventStreamFile = Optional.empty();
        private Optional<Path> snapshotFile = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;
        private final List<ControllerBinding> extraControllers = new ArrayList<>();
        private boolean logEvents;
        private boolean installShutdownHook;

        public Builder manifestTarget(ManifestTarget manifestTarget) {
            this.manifestTarget = manifestTarget;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder settings(KernelSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder eventStreamFile(Optional<Path> eventStreamFile) {
            this.eventStreamFile = eventStreamFile;
            return this;
        }

        public Builder snapshotFile(Optional<Path> snapshotFile) {
            this.snapshotFile = snapshotFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder controller(ResourceDefinition definition, Controller controller) {
            this.extraControllers.add(new ControllerBinding(definition, controller));
            return this;
        }

        /**
         * Logs every kernel event at info level.
         */
        public Builder logEvents(boolean logEvents) {
            this.logEvents = logEvents;
            return this;
        }

        public Builder installShutdownHook(boolean installShutdownHook) {
            this.installShutdownHook = installShutdownHook;
            return this;
        }

        public TeloRunConfiguration build() {
            return new TeloRunConfiguration(
                manifestTarget,
                workingDirectory,
                settings,
                eventStreamFile,
                snapshotFile,
                logLevel,
                extraControllers,
                logEvents,
                installShutdownHook
            );
        }
    }
}
