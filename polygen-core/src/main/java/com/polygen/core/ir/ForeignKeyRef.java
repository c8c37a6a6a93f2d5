package com.polygen.core.ir;

import java.util.Objects;

/**
 * Resolved target of a foreign key.
 *
 * @param targetTable FQN of the referenced table
 * @param targetField referenced field
 * @param relationName explicit reverse relation name, or null
 */
public record ForeignKeyRef(
    String targetTable,
    String targetField,
    String relationName
) {
    public ForeignKeyRef {
        Objects.requireNonNull(targetTable, "targetTable must not be null");
        Objects.requireNonNull(targetField, "targetField must not be null");
    }
}
