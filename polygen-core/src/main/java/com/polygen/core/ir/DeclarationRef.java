package com.polygen.core.ir;

import com.polygen.core.ast.DefinitionKind;

import java.util.Objects;

/**
 * Handle to a namespace-level declaration.
 *
 * @param kind table, enum or embed
 * @param fqn key into the matching map of {@link SchemaIr}
 */
public record DeclarationRef(
    DefinitionKind kind,
    String fqn
) {
    public DeclarationRef {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fqn, "fqn must not be null");
    }
}
