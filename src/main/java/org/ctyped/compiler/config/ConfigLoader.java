package org.ctyped.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the front-end configuration from layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "ctyped.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dctyped.parser.max-nesting-depth=512)
     * 3. Configuration File (ctyped.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Same as {@link #load()} but reads the file layer from the given location.
     *
     * @param configFile The file layer. A missing file is skipped.
     * @return A resolved {@link Config}.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(propertyConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
