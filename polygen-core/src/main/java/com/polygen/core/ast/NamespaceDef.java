package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A namespace block.
 *
 * @param name dotted name as written, relative to the enclosing namespace
 * @param annotations namespace annotations
 * @param imports namespace imports in source order
 * @param members nested definitions in source order
 * @param doc doc comment or null
 * @param location source position
 */
public record NamespaceDef(
    String name,
    List<Annotation> annotations,
    List<NamespaceImport> imports,
    List<Definition> members,
    String doc,
    SourceLocation location
) implements Definition {

    public NamespaceDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        members = members != null ? List.copyOf(members) : List.of();
    }

    @Override
    public DefinitionKind definitionKind() {
        return DefinitionKind.NAMESPACE;
    }
}
