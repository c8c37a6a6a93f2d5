package com.polygen.core.ir;

import java.util.Objects;

/**
 * Many-to-many relation expressed through a junction table.
 *
 * @param junctionTable FQN of the table holding both foreign keys
 * @param leftTable FQN of the first referenced table
 * @param leftField junction field referencing the first table
 * @param rightTable FQN of the second referenced table
 * @param rightField junction field referencing the second table
 */
public record ManyToManyIr(
    String junctionTable,
    String leftTable,
    String leftField,
    String rightTable,
    String rightField
) {
    public ManyToManyIr {
        Objects.requireNonNull(junctionTable, "junctionTable must not be null");
        Objects.requireNonNull(leftTable, "leftTable must not be null");
        Objects.requireNonNull(leftField, "leftField must not be null");
        Objects.requireNonNull(rightTable, "rightTable must not be null");
        Objects.requireNonNull(rightField, "rightField must not be null");
    }
}
