package com.polygen.core.ir;

import java.util.Objects;

/**
 * Directed edge inferred from a foreign key, with its reverse navigation.
 *
 * @param sourceTable FQN of the table declaring the foreign key
 * @param sourceField foreign-key field
 * @param targetTable FQN of the referenced table
 * @param targetField referenced key field
 * @param forward multiplicity from the field's cardinality
 * @param reverseName name of the navigation from target back to source
 * @param reverse multiplicity of the reverse navigation
 * @param explicitName true when the reverse name was written with {@code as}
 */
public record RelationshipIr(
    String sourceTable,
    String sourceField,
    String targetTable,
    String targetField,
    Multiplicity forward,
    String reverseName,
    Multiplicity reverse,
    boolean explicitName
) {
    public RelationshipIr {
        Objects.requireNonNull(sourceTable, "sourceTable must not be null");
        Objects.requireNonNull(sourceField, "sourceField must not be null");
        Objects.requireNonNull(targetTable, "targetTable must not be null");
        Objects.requireNonNull(targetField, "targetField must not be null");
        Objects.requireNonNull(forward, "forward must not be null");
        Objects.requireNonNull(reverseName, "reverseName must not be null");
        Objects.requireNonNull(reverse, "reverse must not be null");
    }

    public boolean isSelfReference() {
        return sourceTable.equals(targetTable);
    }
}
