package com.ebdgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code ebdgraph.yaml} into {@link EbdGraphConfig} records.
 * If the config file is missing or invalid, returns {@link EbdGraphConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EbdGraphConfig config = ConfigLoader.load(Paths.get("ebdgraph.yaml"));
 * OutcomeVocabulary vocabulary = config.toVocabulary();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "ebdgraph.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link EbdGraphConfig#defaults()}.
     *
     * @param configPath path to {@code ebdgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static EbdGraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return EbdGraphConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EbdGraphConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            EbdGraphConfig config = YAML_MAPPER.readValue(configPath.toFile(), EbdGraphConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EbdGraphConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EbdGraphConfig.defaults();
        }
    }
}
