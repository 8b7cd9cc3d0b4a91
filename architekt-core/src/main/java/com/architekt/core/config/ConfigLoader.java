package com.architekt.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading Architekt configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code architekt.yaml} into {@link ArchitektConfig} records.
 * If the config file is missing or invalid, returns {@link ArchitektConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchitektConfig config = ConfigLoader.load(Path.of("architekt.yaml"));
 * AggregateRepository repository = AggregateRepositories.create(config.persistence());
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "architekt.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ArchitektConfig#defaults()}.
     *
     * @param configPath path to {@code architekt.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ArchitektConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ArchitektConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ArchitektConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ArchitektConfig config = YAML_MAPPER.readValue(configPath.toFile(), ArchitektConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ArchitektConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ArchitektConfig.defaults();
        }
    }
}
