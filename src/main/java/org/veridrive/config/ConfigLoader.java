package org.veridrive.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "veridrive.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dveridrive.optimize=true)
     * 2. Environment Variables
     * 3. The configuration file: the explicit one if given, else -Dconfig.file, else veridrive.conf
     *    in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile The file passed with --config, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws FileNotFoundException if an explicitly requested file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or substitutions fail.
     */
    public static Config load(final File explicitFile) throws FileNotFoundException {
        final Config fileConfig = loadFileConfig(explicitFile);

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private static Config loadFileConfig(final File explicitFile) throws FileNotFoundException {
        if (explicitFile != null) {
            if (!explicitFile.exists()) {
                throw new FileNotFoundException("Configuration file specified via --config was not found: "
                        + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            return ConfigFactory.parseFile(explicitFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new FileNotFoundException("Configuration file specified via -Dconfig.file was not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists() && !cwdConfigFile.isDirectory()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdConfigFile);
        }

        LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }
}
