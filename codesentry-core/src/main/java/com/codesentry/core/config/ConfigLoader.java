package com.codesentry.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads CodeSentry configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codesentry.yaml} into {@link EngineConfig}.
 * If the file is missing or invalid, returns {@link EngineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = ConfigLoader.load(projectDir.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * ExecutionOptions options = config.toOptions(projectDir);
 * }</pre>
 */
public class ConfigLoader {

    /**
     * Name of the configuration file looked up in the project root.
     */
    public static final String DEFAULT_FILE_NAME = "codesentry.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codesentry.yaml}
     * @return loaded configuration, or defaults if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            EngineConfig config = YAML_MAPPER.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EngineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
    }
}
