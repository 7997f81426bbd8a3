package com.syntaxlens.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code syntaxlens.yaml} into an {@link AnalyzerConfig}.
 *
 * <p>Never throws: a missing, unreadable or malformed file logs a warning and yields
 * {@link AnalyzerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Path.of("syntaxlens.yaml"));
 * JsParseOptions options = config.javascript().toParseOptions();
 * }</pre>
 */
public class ConfigLoader {

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = "syntaxlens.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from the given directory.
     *
     * @param directory directory to look in
     * @return loaded configuration or defaults
     */
    public static AnalyzerConfig loadFromDirectory(Path directory) {
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}
