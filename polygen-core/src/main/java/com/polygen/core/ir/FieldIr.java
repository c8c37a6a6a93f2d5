package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.Constraint;
import com.polygen.core.ast.ConstraintKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field with its resolved type.
 *
 * @param name field name
 * @param type resolved type
 * @param constraints constraints in source order
 * @param annotations field annotations
 * @param foreignKey resolved foreign key, or null
 * @param fieldNumber explicit field number, or null
 * @param doc doc comment, or null
 */
public record FieldIr(
    String name,
    TypeRef type,
    List<Constraint> constraints,
    List<Annotation> annotations,
    ForeignKeyRef foreignKey,
    Integer fieldNumber,
    String doc
) {
    public FieldIr {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }

    public boolean hasConstraint(ConstraintKind kind) {
        return constraints.stream().anyMatch(c -> c.kind() == kind);
    }

    public boolean isPrimaryKey() {
        return hasConstraint(ConstraintKind.PRIMARY_KEY);
    }

    public Optional<ForeignKeyRef> foreignKeyRef() {
        return Optional.ofNullable(foreignKey);
    }
}
