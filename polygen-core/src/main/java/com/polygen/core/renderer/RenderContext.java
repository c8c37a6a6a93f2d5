package com.polygen.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Where and how a renderer writes one compilation's output.
 *
 * @param outputDirectory target directory for file-based renderers
 * @param settings renderer settings keyed {@code <rendererId>.<name>}, e.g. {@code filesystem.clean}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Text setting.
     *
     * @param key setting key
     * @param defaultValue value used when the key is absent
     * @return configured value or the default
     */
    public String setting(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Boolean setting; anything other than {@code "true"} (ignoring case) is false.
     *
     * @param key setting key
     * @param defaultValue value used when the key is absent
     * @return configured flag or the default
     */
    public boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
