package org.channelsim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.channelsim.runtime.EngineSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.nested.setting");
        System.clearProperty("channelsim.engine.temperature-kelvin");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(310.15, config.getDouble("channelsim.engine.temperature-kelvin"));
        // untouched keys come from reference.conf
        assertEquals(1e-9, config.getDouble("channelsim.engine.absolute-tolerance"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("channelsim.engine.temperature-kelvin", "300");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(300.0, config.getDouble("channelsim.engine.temperature-kelvin"));
    }

    @Test
    @DisplayName("System property should override nested configuration values")
    void loadFromFile_systemPropertyShouldOverrideNestedConfig() {
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("loadDefaults should expose the engine defaults of reference.conf")
    void loadDefaults_shouldExposeEngineDefaults() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(EngineSettings.defaults(), EngineSettings.fromConfig(config.getConfig("channelsim.engine")));
    }

    @Test
    @DisplayName("Engine settings should pick up the file overrides")
    void loadFromFile_engineSettingsReflectFile() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        EngineSettings settings = EngineSettings.fromConfig(config.getConfig("channelsim.engine"));

        assertEquals(310.15, settings.temperatureKelvin());
        assertEquals(1e-8, settings.relativeTolerance());
        assertEquals(1e-6, settings.defaultVolumeExternalLiters());
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_explicitFileIsUsedAndReported() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + ": " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO: Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should fail for a missing explicit file")
    void resolve_missingExplicitFileFails() {
        File missing = new File("does-not-exist/channelsim.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("Configuration file not found"));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
