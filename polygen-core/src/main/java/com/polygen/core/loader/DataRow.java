package com.polygen.core.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One loaded row.
 *
 * @param values column values by name, in source column order
 * @param sourceFile file the row came from, relative to the loader's base directory
 */
public record DataRow(
    Map<String, Object> values,
    String sourceFile
) {
    public DataRow {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }
}
