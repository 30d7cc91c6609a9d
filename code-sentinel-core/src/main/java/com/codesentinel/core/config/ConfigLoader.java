package com.codesentinel.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodeSentinel configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codesentinel.yaml} into {@link SentinelConfig} records.
 * If the config file is missing or invalid, returns {@link SentinelConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SentinelConfig config = ConfigLoader.load(Paths.get("codesentinel.yaml"));
 * AnalysisOptions options = config.analysis().toOptions();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codesentinel.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SentinelConfig#defaults()}.
     *
     * @param configPath path to {@code codesentinel.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SentinelConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SentinelConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SentinelConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SentinelConfig config = YAML_MAPPER.readValue(configPath.toFile(), SentinelConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SentinelConfig.defaults();
            }
            // rejects negative weights
            config.scoring().weights().toSeverityWeights();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SentinelConfig.defaults();
        }
    }

    /**
     * Loads {@code codesentinel.yaml} from a directory if present, defaults otherwise.
     *
     * <p>Unlike {@link #load(Path)}, a missing file is not worth a warning here.
     *
     * @param directory directory to look in
     * @return loaded configuration or defaults
     */
    public static SentinelConfig loadFromDirectory(Path directory) {
        Path candidate = directory.resolve(DEFAULT_FILE_NAME);
        if (!Files.exists(candidate)) {
            log.debug("No {} in {}, using defaults", DEFAULT_FILE_NAME, directory);
            return SentinelConfig.defaults();
        }
        return load(candidate);
    }
}
