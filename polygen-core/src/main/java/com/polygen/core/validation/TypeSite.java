package com.polygen.core.validation;

import com.polygen.core.ast.Definition;
import com.polygen.core.ast.EmbedDef;
import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.TableDef;

import java.util.Objects;
import java.util.Optional;

/**
 * A table, enum or embed together with where it was declared.
 *
 * @param fqn fully qualified name; for inline types {@code <owner FQN>.<field name>}
 * @param definition AST node
 * @param namespaceFqn namespace the type belongs to
 * @param ownerFqn FQN of the enclosing table/embed, or null at namespace level
 * @param siteKind declaration site
 * @param innerScope lookup scope for names referenced inside this type
 */
public record TypeSite(
    String fqn,
    Definition definition,
    String namespaceFqn,
    String ownerFqn,
    SiteKind siteKind,
    Scope innerScope
) {
    /**
     * Where a type was declared.
     */
    public enum SiteKind {
        /** Directly in a namespace (or the root). */
        NAMESPACE_LEVEL,
        /** Named, inside a table or embed body. */
        NESTED,
        /** Anonymous, as a field's type. */
        INLINE
    }

    public TypeSite {
        Objects.requireNonNull(fqn, "fqn must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(namespaceFqn, "namespaceFqn must not be null");
        Objects.requireNonNull(siteKind, "siteKind must not be null");
        Objects.requireNonNull(innerScope, "innerScope must not be null");
    }

    public boolean isTable() {
        return definition instanceof TableDef;
    }

    public boolean isEmbed() {
        return definition instanceof EmbedDef;
    }

    public boolean isEnum() {
        return definition instanceof EnumDef;
    }

    public Optional<FieldContainer> container() {
        return definition instanceof FieldContainer container ? Optional.of(container) : Optional.empty();
    }
}
