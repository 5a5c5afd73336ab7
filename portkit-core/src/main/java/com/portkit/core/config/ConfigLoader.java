package com.portkit.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading PortKit configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code portkit.yaml} into {@link PortkitConfig} records.
 * If the config file is missing or invalid, returns {@link PortkitConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PortkitConfig config = ConfigLoader.load(Paths.get("portkit.yaml"));
 * int limit = config.orchestrator().concurrency();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "portkit.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link PortkitConfig#defaults()}.
     *
     * @param configPath path to {@code portkit.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PortkitConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return PortkitConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PortkitConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PortkitConfig config = YAML_MAPPER.readValue(configPath.toFile(), PortkitConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PortkitConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PortkitConfig.defaults();
        }
    }
}
