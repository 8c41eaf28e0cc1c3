package org.pxdforge.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxdforge.generator.GeneratorOptions;

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
 *   <li>Environment Variables</li>
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
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("pxdforge.generator.strict");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertTrue(config.hasPath("test.value"));
        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
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
    @DisplayName("Should resolve configuration references after layering")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals("base/include", config.getString("pxdforge.generator.include-base"));
    }

    @Test
    @DisplayName("Generator options should combine file values and reference defaults")
    void loadFromFile_generatorSectionYieldsOptions() {
        System.setProperty("pxdforge.generator.strict", "true");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));
        GeneratorOptions options = GeneratorOptions.fromConfig(config.getConfig("pxdforge.generator"));

        assertEquals(3, options.warningLevel());
        assertTrue(options.autodefine());
        assertTrue(options.strict());
        assertFalse(options.recursive());
        assertNull(options.layout());
        assertNull(options.headersGlob());
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();
        GeneratorOptions options = GeneratorOptions.fromConfig(config.getConfig("pxdforge.generator"));

        assertEquals(GeneratorOptions.defaults(), options);
    }

    @Test
    @DisplayName("Explicit config file should be used and reported")
    void resolve_explicitFileIsUsed() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("Missing explicit config file should be rejected")
    void resolve_missingExplicitFileThrows() {
        File missing = new File("does-not-exist/pxdforge.conf");

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(missing, (level, message) -> { }));
    }

    @Test
    @DisplayName("config.file system property should select the file")
    void resolve_systemPropertyFileIsUsed() {
        System.setProperty("config.file", testResource("test-config.conf").getPath());

        Config config = ConfigLoader.resolve(null, (level, message) -> { });

        assertEquals("file-nested", config.getString("test.nested.setting"));
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
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
