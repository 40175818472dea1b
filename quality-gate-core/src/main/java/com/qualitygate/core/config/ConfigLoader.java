package com.qualitygate.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading quality gate configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code .qualitygate.yaml} into {@link QualityConfig} records.
 * A missing file yields {@link QualityConfig#defaults()}; a file that exists but cannot be
 * read or parsed is a {@link ConfigurationException}, since a run must not start from a
 * configuration it could not understand.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * QualityConfig config = ConfigLoader.loadAndValidate(projectRoot.resolve(".qualitygate.yaml"));
 *
 * if (config.analyzers().isEnabled(AnalysisCategory.SECURITY)) {
 *     // Security analyzer will run
 * }
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = ".qualitygate.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code .qualitygate.yaml}
     * @return loaded configuration, or defaults if the file does not exist
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public static QualityConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return QualityConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            String content = Files.readString(configPath);
            if (content.isBlank()) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return QualityConfig.defaults();
            }
            QualityConfig config = YAML_MAPPER.readValue(content, QualityConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config != null ? config : QualityConfig.defaults();
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration and validates its invariants.
     *
     * @param configPath path to {@code .qualitygate.yaml}
     * @return valid configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public static QualityConfig loadAndValidate(Path configPath) {
        QualityConfig config = load(configPath);
        ConfigValidator.validate(config);
        return config;
    }
}
