package org.gridlayout.engine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the engine limits from layered configuration sources.
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "gridlayout.conf";

    private EngineConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dgridlayout.engine.move.minIterations=100)
     * 3. Configuration File (gridlayout.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Same as {@link #load()} with an explicit configuration file.
     *
     * @param configFile The optional file layer; skipped if it does not exist.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading layout engine configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Loads the layered configuration and extracts the engine limits.
     */
    public static EngineLimits loadLimits() {
        return limitsFrom(load());
    }

    /**
     * Extracts the engine limits from the {@code gridlayout.engine} subtree of a configuration.
     *
     * @param config A resolved configuration.
     * @return The limits.
     */
    public static EngineLimits limitsFrom(final Config config) {
        EngineLimits limits = new EngineLimits(config.getConfig(org.gridlayout.engine.Config.CONFIG_PATH));
        LOG.debug("Layout engine limits: {}", limits);
        return limits;
    }
}
