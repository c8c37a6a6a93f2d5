package com.polygen.core.generator;

import java.util.Map;

/**
 * Configuration for artifact generation.
 *
 * @param theme diagram theme to apply, or null for the renderer's default
 * @param includeEnums whether diagrams show enums as separate classes
 * @param namespaceFilter only namespaces with this FQN prefix are generated; null for all
 * @param customSettings generator settings keyed {@code <generatorId>.<name>}
 */
public record GeneratorConfig(
    String theme,
    boolean includeEnums,
    String namespaceFilter,
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (namespaceFilter != null && namespaceFilter.isBlank()) {
            namespaceFilter = null;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, true, null, Map.of());
    }

    /**
     * Whether a namespace passes the namespace filter.
     *
     * @param namespaceFqn namespace FQN, empty for the root namespace
     * @return true if the namespace should be generated
     */
    public boolean includesNamespace(String namespaceFqn) {
        if (namespaceFilter == null) {
            return true;
        }
        return namespaceFqn.equals(namespaceFilter) || namespaceFqn.startsWith(namespaceFilter + ".");
    }

    /**
     * Text setting, e.g. {@code markdown.title}.
     *
     * @param key setting key, prefixed with the generator id
     * @param defaultValue value used when the key is absent
     * @return configured value as text, or the default
     */
    public String setting(String key, String defaultValue) {
        Object value = customSettings.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Boolean setting, e.g. {@code json-ir.pretty}. YAML booleans and the strings
     * {@code "true"}/{@code "false"} are both accepted.
     *
     * @param key setting key, prefixed with the generator id
     * @param defaultValue value used when the key is absent
     * @return configured flag or the default
     */
    public boolean flag(String key, boolean defaultValue) {
        Object value = customSettings.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null ? Boolean.parseBoolean(value.toString().trim()) : defaultValue;
    }
}
