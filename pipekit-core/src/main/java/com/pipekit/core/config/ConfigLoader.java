package com.pipekit.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading PipeKit configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code pipekit.yaml} into {@link PipelineConfig} records.
 * If the config file is missing or invalid, returns {@link PipelineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PipelineConfig config = ConfigLoader.load(Paths.get("pipekit.yaml"));
 * List<String> names = config.componentNames(PipelineTemplates.DEFAULTS);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link PipelineConfig#defaults()}.
     *
     * @param configPath path to {@code pipekit.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PipelineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (template '{}').",
                configPath, PipelineConfig.DEFAULT_TEMPLATE);
            return PipelineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PipelineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PipelineConfig config = YAML_MAPPER.readValue(configPath.toFile(), PipelineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PipelineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PipelineConfig.defaults();
        }
    }
}
