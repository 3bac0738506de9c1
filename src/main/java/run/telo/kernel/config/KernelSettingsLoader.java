package run.telo.kernel.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link KernelSettings} from an optional {@code telo.toml} and {@code telo.kernel.*} system properties.
 *
 * <pre>
 * [kernel]
 * max-discovery-passes = 10
 * max-resolution-passes = 5
 *
 * [expressions]
 * allowed-env = ["PORT", "HOST"]
 * deferred-roots = ["request", "result"]
 * </pre>
 */
public final class KernelSettingsLoader {
    public static final String PROPERTY_PREFIX = "telo.kernel.";

    private static final Logger LOG = LoggerFactory.getLogger(KernelSettingsLoader.class);

    private KernelSettingsLoader() {}

    public static KernelSettings load(Path tomlFile) {
        return load(tomlFile, System.getProperties());
    }

    public static KernelSettings load(Path tomlFile, Properties overrides) {
        var builder = KernelSettings.builder();
        if (tomlFile != null) {
            applyToml(builder, parseToml(tomlFile));
            LOG.debug("Loaded kernel settings from {}", tomlFile);
        }
        applyProperties(builder, overrides);
        return builder.build();
    }

    private static TomlParseResult parseToml(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Settings file not found: " + path);
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
                throw new IllegalArgumentException("Invalid settings file " + path + ": " + errors);
            }
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings file: " + path, ex);
        }
    }

    private static void applyToml(KernelSettings.Builder builder, TomlParseResult toml) {
        TomlTable kernel = toml.getTable("kernel");
        if (kernel != null) {
            readInt(kernel, "max-discovery-passes", builder::maxDiscoveryPasses);
            readInt(kernel, "max-resolution-passes", builder::maxResolutionPasses);
            readInt(kernel, "max-expansion-depth", builder::maxExpansionDepth);
            readInt(kernel, "max-expansion-passes", builder::maxExpansionPasses);
        }
        TomlTable expressions = toml.getTable("expressions");
        if (expressions != null) {
            var allowedEnv = readStrings(expressions.getArray("allowed-env"));
            if (allowedEnv != null) {
                builder.allowedEnvironment(allowedEnv);
            }
            var deferred = readStrings(expressions.getArray("deferred-roots"));
            if (deferred != null) {
                builder.deferredRoots(deferred);
            }
        }
    }

    private static void applyProperties(KernelSettings.Builder builder, Properties properties) {
        if (properties == null) {
            return;
        }
        readIntProperty(properties, "maxDiscoveryPasses", builder::maxDiscoveryPasses);
        readIntProperty(properties, "maxResolutionPasses", builder::maxResolutionPasses);
        readIntProperty(properties, "maxExpansionDepth", builder::maxExpansionDepth);
        readIntProperty(properties, "maxExpansionPasses", builder::maxExpansionPasses);
        var allowedEnv = properties.getProperty(PROPERTY_PREFIX + "allowedEnv");
        if (allowedEnv != null) {
            builder.allowedEnvironment(splitList(allowedEnv));
        }
        var deferred = properties.getProperty(PROPERTY_PREFIX + "deferredRoots");
        if (deferred != null) {
            builder.deferredRoots(splitList(deferred));
        }
    }

    private static void readInt(TomlTable table, String key, IntConsumer target) {
        Long value = table.getLong(key);
        if (value != null) {
            target.accept(Math.toIntExact(value));
        }
    }

    private static void readIntProperty(Properties properties, String key, IntConsumer target) {
        var raw = properties.getProperty(PROPERTY_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            target.accept(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + raw, ex);
        }
    }

    private static List<String> readStrings(TomlArray array) {
        if (array == null) {
            return null;
        }
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static List<String> splitList(String raw) {
        var values = new ArrayList<String>();
        for (var part : raw.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }
}
