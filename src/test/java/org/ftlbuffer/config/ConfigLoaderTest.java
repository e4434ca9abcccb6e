package org.ftlbuffer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.ftlbuffer.junit.extensions.logging.AllowLog;
import org.ftlbuffer.junit.extensions.logging.LogLevel;
import org.ftlbuffer.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TEST_CONFIG = "org/ftlbuffer/config/test-config.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("ftlbuffer.bundle.locale");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load configuration file on top of the reference defaults")
    void load_shouldLoadConfigFileWithDefaults() {
        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertEquals("file-value", config.getString("test.value"));
        assertEquals("de-DE", config.getString("ftlbuffer.bundle.locale"));
        assertEquals(50, config.getInt("ftlbuffer.bundle.cache.size"));
        // Not set in the file, comes from reference.conf
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        // Arrange
        System.setProperty("test.value", "system-value");
        System.setProperty("ftlbuffer.bundle.locale", "fr-FR");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertEquals("system-value", config.getString("test.value"));
        assertEquals("fr-FR", config.getString("ftlbuffer.bundle.locale"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file 'non-existent-config.conf' not found or is empty. Using defaults.")
    @DisplayName("Should handle missing configuration resource gracefully")
    void load_shouldHandleMissingConfigResource() {
        // Act
        Config config = ConfigLoader.load("non-existent-config.conf");

        // Assert
        assertEquals("en-US", config.getString("ftlbuffer.bundle.locale"));
        assertTrue(config.getBoolean("ftlbuffer.bundle.use-isolating"));
    }

    @Test
    @DisplayName("Should load an explicit configuration file")
    void load_shouldLoadExplicitFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "ftlbuffer.bundle.cache.enabled = true\n");

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertTrue(config.getBoolean("ftlbuffer.bundle.cache.enabled"));
        assertEquals(1000, config.getInt("ftlbuffer.bundle.cache.size"));
    }

    @Test
    @DisplayName("Should reject a missing explicit configuration file")
    void load_shouldRejectMissingExplicitFile(@TempDir Path dir) {
        File missing = dir.resolve("missing.conf").toFile();

        assertThrows(ConfigException.class, () -> ConfigLoader.load(missing));
    }
}
