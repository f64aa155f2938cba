package org.initscan.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from several sources.
 * The loader respects a fixed precedence order so that single values can be overridden
 * without editing the configuration file.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "initscan.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads {@value #CONFIG_FILE_NAME} from the working directory if present.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java system properties (e.g. -Dinitscan.extractor.key-pattern=...)
     * 2. Environment overrides (CONFIG_FORCE_initscan_extractor_key__pattern=...)
     * 3. The given configuration file, looked up on the file system first and on the classpath second
     * 4. Default values (reference.conf on the classpath)
     *
     * @param location Path or classpath resource name of the configuration file; may be {@code null}.
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load(final String location) {
        final Config sysConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();

        Config fileConfig = ConfigFactory.empty();
        if (location != null) {
            final File configFile = new File(location);
            if (configFile.isFile()) {
                LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                fileConfig = ConfigFactory.parseResources(location);
                if (fileConfig.isEmpty()) {
                    LOG.debug("Configuration '{}' not found. Using defaults.", location);
                } else {
                    LOG.debug("Loading configuration from classpath resource: {}", location);
                }
            }
        }

        final Config defaultConfig = ConfigFactory.defaultReference();

        // The config given first wins.
        return sysConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
