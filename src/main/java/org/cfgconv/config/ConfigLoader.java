package org.cfgconv.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dconverter.output.indent=4)
     * 2. Configuration file given by the caller, if any
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configFile An optional configuration file; may be {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if the file is missing or cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            fileConfig = ConfigFactory.empty();
        }

        final Config combinedConfig = ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"));

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
