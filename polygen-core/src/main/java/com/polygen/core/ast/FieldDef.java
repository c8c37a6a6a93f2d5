package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field of a table or embed.
 *
 * @param name field name
 * @param type declared type
 * @param cardinality scalar, optional or array
 * @param constraints constraints in source order
 * @param annotations field annotations
 * @param fieldNumber explicit field number ({@code = N}), or null
 * @param doc doc comment or null
 * @param location source position
 */
public record FieldDef(
    String name,
    TypeExpr type,
    Cardinality cardinality,
    List<Constraint> constraints,
    List<Annotation> annotations,
    Integer fieldNumber,
    String doc,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public FieldDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (cardinality == null) {
            cardinality = Cardinality.SCALAR;
        }
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }

    public boolean hasConstraint(ConstraintKind kind) {
        return constraints.stream().anyMatch(c -> c.kind() == kind);
    }

    public Optional<Constraint> constraint(ConstraintKind kind) {
        return constraints.stream()
            .filter(c -> c.kind() == kind)
            .findFirst();
    }

    public Optional<Constraint.ForeignKey> foreignKey() {
        return constraint(ConstraintKind.FOREIGN_KEY).map(Constraint.ForeignKey.class::cast);
    }

    /**
     * Whether the field uniquely identifies a row: {@code primary_key} or {@code unique}.
     *
     * @return true for key fields
     */
    public boolean isUniqueKey() {
        return hasConstraint(ConstraintKind.PRIMARY_KEY) || hasConstraint(ConstraintKind.UNIQUE);
    }
}
