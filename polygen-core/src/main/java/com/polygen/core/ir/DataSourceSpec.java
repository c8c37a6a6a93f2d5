package com.polygen.core.ir;

import java.util.Map;
import java.util.Objects;

/**
 * Interpreted {@code @load} or {@code @save} annotation.
 *
 * @param type backing store
 * @param path file or glob for {@link DataSourceType#MAP}; null otherwise
 * @param params any further annotation arguments, by name
 */
public record DataSourceSpec(
    DataSourceType type,
    String path,
    Map<String, String> params
) {
    public DataSourceSpec {
        Objects.requireNonNull(type, "type must not be null");
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
