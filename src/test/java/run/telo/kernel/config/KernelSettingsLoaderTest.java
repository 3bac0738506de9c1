package run.telo.kernel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import run.telo.kernel.support.KernelTestSupport;

final class KernelSettingsLoaderTest {
    @Test
    void defaultsApplyWithoutAFile() {
        var settings = KernelSettingsLoader.load(null, new Properties());

        assertEquals(KernelSettings.defaults(), settings);
        assertEquals(10, settings.maxDiscoveryPasses());
        assertEquals(List.of("request", "result"), settings.deferredRoots());
    }

    @Test
    void readsKernelAndExpressionTables() {
        var settings = KernelSettingsLoader.load(KernelTestSupport.fixture("config", "telo.toml"), new Properties());

        assertEquals(4, settings.maxDiscoveryPasses());
        assertEquals(3, settings.maxResolutionPasses());
        assertEquals(6, settings.maxExpansionDepth());
        assertEquals(10, settings.maxExpansionPasses());
        assertEquals(List.of("PORT", "TELO_ENV"), settings.allowedEnvironment());
        assertEquals(List.of("request"), settings.deferredRoots());
    }

    @Test
    void systemPropertiesOverrideTheFile() {
        var overrides = new Properties();
        overrides.setProperty("telo.kernel.maxDiscoveryPasses", "7");
        overrides.setProperty("telo.kernel.allowedEnv", "HOME, ,USER");

        var settings = KernelSettingsLoader.load(KernelTestSupport.fixture("config", "telo.toml"), overrides);

        assertEquals(7, settings.maxDiscoveryPasses());
        assertEquals(3, settings.maxResolutionPasses());
        assertEquals(List.of("HOME", "USER"), settings.allowedEnvironment());
    }

    @Test
    void rejectsInvalidValues(@TempDir Path dir) throws Exception {
        var overrides = new Properties();
        overrides.setProperty("telo.kernel.maxResolutionPasses", "many");
        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.load(null, overrides));

        var zero = dir.resolve("zero.toml");
        Files.writeString(zero, "[kernel]\nmax-discovery-passes = 0\n");
        var error = assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.load(zero, new Properties()));
        assertTrue(error.getMessage().contains("maxDiscoveryPasses must be at least 1"), error.getMessage());

        var broken = dir.resolve("broken.toml");
        Files.writeString(broken, "[kernel\n");
        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.load(broken, new Properties()));
        assertThrows(IllegalArgumentException.class, () -> KernelSettingsLoader.load(dir.resolve("missing.toml"), new Properties()));
    }
}
