package com.polygen.core.validation;

import com.polygen.core.ast.NamespaceImport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lookup scope for type names referenced from inside a definition.
 *
 * @param namespaceFqn enclosing namespace; empty for the root namespace
 * @param enclosingTypes FQNs of enclosing tables/embeds, innermost first
 * @param imports namespace imports visible in this scope
 */
public record Scope(
    String namespaceFqn,
    List<String> enclosingTypes,
    List<NamespaceImport> imports
) {
    public Scope {
        Objects.requireNonNull(namespaceFqn, "namespaceFqn must not be null");
        enclosingTypes = enclosingTypes != null ? List.copyOf(enclosingTypes) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
    }

    /**
     * Scope for the body of a type nested in this scope.
     *
     * @param typeFqn FQN of the entered type
     * @return inner scope
     */
    public Scope enter(String typeFqn) {
        List<String> types = new ArrayList<>(enclosingTypes.size() + 1);
        types.add(typeFqn);
        types.addAll(enclosingTypes);
        return new Scope(namespaceFqn, types, imports);
    }
}
