package org.ftlbuffer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "ftlbuffer.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dftlbuffer.bundle.locale=de-DE)
     * 3. Configuration File (ftlbuffer.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layered(fileConfig);
    }

    /**
     * Loads the configuration with an explicit file in place of {@code ftlbuffer.conf}.
     *
     * @param configFile The configuration file.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the file does not exist or cannot be parsed.
     */
    public static Config load(final File configFile) {
        LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
        final Config fileConfig = ConfigFactory.parseFile(configFile,
                ConfigParseOptions.defaults().setAllowMissing(false));
        return layered(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of {@code ftlbuffer.conf}.
     * A missing or empty resource falls back to the defaults.
     *
     * @param resourcePath The classpath resource, e.g. {@code org/ftlbuffer/config/test-config.conf}.
     * @return The resolved configuration.
     */
    public static Config load(final String resourcePath) {
        final Config resourceConfig = ConfigFactory.parseResources(resourcePath);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", resourcePath);
        }
        return layered(resourceConfig);
    }

    private static Config layered(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
