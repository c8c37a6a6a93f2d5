package com.polygen.core.imports;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.Definition;
import com.polygen.core.ast.NamespaceImport;
import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One logical namespace after merging every declaration that shares its FQN.
 *
 * @param fqn dotted namespace name; empty for the root namespace
 * @param annotations annotations of all declarations, in file-visitation order
 * @param imports namespace imports of all declarations
 * @param types tables, enums and embeds in file-visitation then declaration order
 * @param doc first non-null doc comment
 * @param declarations locations of every {@code namespace} block with this FQN
 */
public record MergedNamespace(
    String fqn,
    List<Annotation> annotations,
    List<NamespaceImport> imports,
    List<Definition> types,
    String doc,
    List<SourceLocation> declarations
) {
    public MergedNamespace {
        Objects.requireNonNull(fqn, "fqn must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        types = types != null ? List.copyOf(types) : List.of();
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
    }

    public boolean isRoot() {
        return fqn.isEmpty();
    }
}
