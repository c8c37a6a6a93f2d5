package com.polygen.core.ast;

/**
 * How many values a field holds: {@code T}, {@code T?} or {@code T[]}.
 */
public enum Cardinality {
    SCALAR(""),
    OPTIONAL("?"),
    ARRAY("[]");

    private final String suffix;

    Cardinality(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Suffix appended to the type name in schema syntax.
     *
     * @return {@code ""}, {@code "?"} or {@code "[]"}
     */
    public String suffix() {
        return suffix;
    }
}
