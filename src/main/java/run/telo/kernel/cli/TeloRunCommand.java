package run.telo.kernel.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import run.telo.kernel.api.LogLevel;
import run.telo.kernel.api.ManifestTarget;
import run.telo.kernel.api.RunResult;
import run.telo.kernel.api.TeloRunConfiguration;
import run.telo.kernel.api.TeloRunner;
import run.telo.kernel.config.KernelSettings;
import run.telo.kernel.config.KernelSettingsLoader;

@CommandLine.Command(
    name = "telo",
    description = "Boot a Telo manifest and run its resources until the runtime is idle.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TeloRunCommand implements Callable<Integer> {
    static final String DEBUG_DIRECTORY = ".telo-debug";
    static final String DEFAULT_CONFIG_FILE = "telo.toml";

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "<manifest>",
        description = "Manifest file, directory of manifests, or HTTP(S) URL."
    )
    private String manifest;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log kernel progress and every event (info level).")
    private boolean verbose;

    @CommandLine.Option(
        names = "--debug",
        description = "Log at debug level and record every event to " + DEBUG_DIRECTORY + "/events.jsonl."
    )
    private boolean debug;

    @CommandLine.Option(
        names = "--snapshot-on-exit",
        paramLabel = "PATH",
        arity = "0..1",
        fallbackValue = DEBUG_DIRECTORY + "/snapshot.yaml",
        description = "Write a YAML snapshot of the runtime when it stops (default path: ${FALLBACK-VALUE})."
    )
    private Path snapshotFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Kernel log threshold (trace|debug|info|warn|error|fatal|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "<telo.toml>",
        description = "Kernel settings file (default: telo.toml in the working directory when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(names = "--max-discovery-passes", description = "Override the discovery pass limit.")
    private Integer maxDiscoveryPasses;

    @CommandLine.Option(names = "--max-resolution-passes", description = "Override the expression resolution pass limit.")
    private Integer maxResolutionPasses;

    @CommandLine.Option(names = "--json", description = "Print the run result as JSON.")
    private boolean json;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var target = detectManifestTarget(manifest);
        var workingDir = Paths.get("").toAbsolutePath();
        var configuration = TeloRunConfiguration.builder()
            .manifestTarget(target)
            .workingDirectory(workingDir)
            .settings(resolveSettings(workingDir))
            .eventStreamFile(debug ? Optional.of(workingDir.resolve(DEBUG_DIRECTORY).resolve("events.jsonl")) : Optional.empty())
            .snapshotFile(Optional.ofNullable(snapshotFile))
            .logLevel(resolveLogLevel())
            .logEvents(verbose || debug)
            .installShutdownHook(true)
            .build();

        RunResult result = new TeloRunner().run(configuration);
        if (json) {
            spec.commandLine().getOut().println(result.toPrettyJson());
        } else if (!result.isSuccess() && result.metadata().get("error") instanceof String error) {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(error));
        }
        return result.exitCode();
    }

    private ManifestTarget detectManifestTarget(String value) {
        var target = ManifestTarget.parse(value);
        if (target.isRemote() || value.contains("${{")) {
            return target;
        }
        var path = target.localPath().orElseThrow().toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Manifest not found: " + path);
        }
        return ManifestTarget.forLocal(path);
    }

    private KernelSettings resolveSettings(Path workingDir) {
        Path settingsFile = configFile;
        if (settingsFile == null && Files.isRegularFile(workingDir.resolve(DEFAULT_CONFIG_FILE))) {
            settingsFile = workingDir.resolve(DEFAULT_CONFIG_FILE);
        }
        KernelSettings loaded;
        try {
            loaded = KernelSettingsLoader.load(settingsFile);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
        var builder = loaded.toBuilder();
        if (maxDiscoveryPasses != null) {
            builder.maxDiscoveryPasses(maxDiscoveryPasses);
        }
        if (maxResolutionPasses != null) {
            builder.maxResolutionPasses(maxResolutionPasses);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        if (logLevelRaw != null) {
            try {
                return LogLevel.from(logLevelRaw);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        if (debug) {
            return LogLevel.DEBUG;
        }
        return verbose ? LogLevel.INFO : LogLevel.WARN;
    }
}
