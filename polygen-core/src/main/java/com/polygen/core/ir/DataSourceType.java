package com.polygen.core.ir;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Backing store named by {@code @load} / {@code @save}.
 */
public enum DataSourceType {
    DB("DB"),
    MAP("Map"),
    MEMORY("Memory");

    private final String schemaName;

    DataSourceType(String schemaName) {
        this.schemaName = schemaName;
    }

    /**
     * Parses the {@code type} parameter, ignoring case.
     *
     * @param name value as written
     * @return type or empty
     */
    public static Optional<DataSourceType> fromName(String name) {
        return Arrays.stream(values())
            .filter(t -> t.schemaName.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT)))
            .findFirst();
    }

    public String schemaName() {
        return schemaName;
    }
}
