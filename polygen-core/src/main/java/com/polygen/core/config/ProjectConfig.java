package com.polygen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.validation.ValidationOptions;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for Polygen projects.
 *
 * <p>Loaded from {@code polygen.yaml} next to the schema. Defines project metadata,
 * the entry schema, enabled generators, output and validation settings.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: game
 *   version: 1.0.0
 *
 * schema: schemas/game.poly
 *
 * generators:
 *   enabled:
 *     - mermaid
 *     - json-ir
 *     - markdown
 *   theme: dark
 *
 * output:
 *   directory: ./generated
 *   clean: false
 *
 * validation:
 *   allowCompositePrimaryKeys: false
 *   warningsAsErrors: false
 * }</pre>
 *
 * @param project project metadata
 * @param schema entry schema path, relative to the config file
 * @param generators generator configuration
 * @param output output configuration
 * @param validation validation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("schema") String schema,
    @JsonProperty("generators") GeneratorSettings generators,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("validation") ValidationConfig validation
) {
    public static final List<String> DEFAULT_GENERATORS = List.of("mermaid", "json-ir", "markdown");

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("project", "1.0.0", null);
        }
        if (generators == null) {
            generators = new GeneratorSettings(DEFAULT_GENERATORS, null, null, Map.of());
        }
        if (output == null) {
            output = new OutputConfig(null, false);
        }
        if (validation == null) {
            validation = new ValidationConfig(false, false);
        }
    }

    /**
     * Creates a default configuration with all bundled generators enabled.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Generator configuration.
     *
     * @param enabled enabled generator IDs; empty or null enables all discovered generators
     * @param theme diagram theme
     * @param namespace only generate namespaces under this FQN
     * @param settings generator-specific settings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("theme") String theme,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("settings") Map<String, Object> settings
    ) {
        public GeneratorSettings {
            enabled = enabled != null ? List.copyOf(enabled) : List.of();
            settings = settings != null ? Map.copyOf(settings) : Map.of();
        }

        /**
         * Checks if a generator is enabled.
         *
         * @param generatorId generator ID to check
         * @return true if the list is empty or contains the ID
         */
        public boolean isEnabled(String generatorId) {
            return enabled.isEmpty() || enabled.contains(generatorId);
        }

        /**
         * Converts to the configuration handed to generators.
         *
         * @return generator config
         */
        public GeneratorConfig toGeneratorConfig() {
            return new GeneratorConfig(theme, true, namespace, settings);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param clean whether to empty the directory before writing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("clean") Boolean clean
    ) {
        public static final String DEFAULT_DIRECTORY = "./generated";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
        }

        public boolean isClean() {
            return Boolean.TRUE.equals(clean);
        }
    }

    /**
     * Validation settings.
     *
     * @param allowCompositePrimaryKeys accept several {@code primary_key} fields per table
     * @param warningsAsErrors report warnings as errors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("allowCompositePrimaryKeys") Boolean allowCompositePrimaryKeys,
        @JsonProperty("warningsAsErrors") Boolean warningsAsErrors
    ) {
        public ValidationOptions toOptions() {
            return new ValidationOptions(Boolean.TRUE.equals(allowCompositePrimaryKeys), Boolean.TRUE.equals(warningsAsErrors));
        }
    }
}
