package com.polygen.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates and reads {@code polygen.yaml}.
 *
 * <p>Paths inside the file ({@code schema}, {@code output.directory}) are relative to the
 * directory holding the file; {@link #resolve(Path, String)} turns them into usable paths.
 * A missing, empty or malformed file never fails the build: the loader logs a warning
 * and falls back to {@link ProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Path configFile = ConfigLoader.find(Paths.get("")).orElse(Paths.get(ConfigLoader.DEFAULT_FILE_NAME));
 * ProjectConfig config = ConfigLoader.load(configFile);
 * Optional<Path> entry = ConfigLoader.schemaPath(config, configFile);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "polygen.yaml";

    private ConfigLoader() {
    }

    /**
     * Searches a directory and its ancestors for {@value #DEFAULT_FILE_NAME}.
     *
     * @param startDirectory directory to start from
     * @return nearest config file, or empty if no ancestor has one
     */
    public static Optional<Path> find(Path startDirectory) {
        Objects.requireNonNull(startDirectory, "startDirectory must not be null");
        for (Path dir = startDirectory.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(DEFAULT_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                log.debug("Found configuration file: {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Loads configuration from a YAML file, falling back to defaults when the file is
     * unusable.
     *
     * @param configPath path to {@code polygen.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            log.debug("No configuration file at {}, using defaults", configPath);
            return ProjectConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from {} (generators: {})", configPath, config.generators().enabled());
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Entry schema named by the configuration.
     *
     * @param config loaded configuration
     * @param configPath file the configuration was loaded from
     * @return schema path resolved against the config directory, or empty if none is set
     */
    public static Optional<Path> schemaPath(ProjectConfig config, Path configPath) {
        if (config.schema() == null || config.schema().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(resolve(configPath, config.schema()));
    }

    /**
     * Output directory named by the configuration.
     *
     * @param config loaded configuration
     * @param configPath file the configuration was loaded from
     * @return output directory resolved against the config directory
     */
    public static Path outputDirectory(ProjectConfig config, Path configPath) {
        return resolve(configPath, config.output().directory());
    }

    /**
     * Resolves a path written in the config file.
     *
     * @param configPath config file the value came from
     * @param value path as written; absolute paths are returned unchanged
     * @return normalized path
     */
    public static Path resolve(Path configPath, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        Path base = configPath.toAbsolutePath().getParent();
        return (base != null ? base.resolve(path) : path).normalize();
    }
}
