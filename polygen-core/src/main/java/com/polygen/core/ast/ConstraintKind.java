package com.polygen.core.ast;

/**
 * Closed set of field constraints.
 */
public enum ConstraintKind {
    PRIMARY_KEY("primary_key"),
    UNIQUE("unique"),
    INDEX("index"),
    AUTO_INCREMENT("auto_increment"),
    MAX_LENGTH("max_length"),
    DEFAULT("default"),
    RANGE("range"),
    REGEX("regex"),
    FOREIGN_KEY("foreign_key"),
    AUTO_CREATE("auto_create"),
    AUTO_UPDATE("auto_update");

    private final String keyword;

    ConstraintKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Constraints that define an index over the field.
     *
     * @return true for primary_key, unique and index
     */
    public boolean isKey() {
        return this == PRIMARY_KEY || this == UNIQUE || this == INDEX;
    }
}
