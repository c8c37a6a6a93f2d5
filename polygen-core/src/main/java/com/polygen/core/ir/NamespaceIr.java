package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.DefinitionKind;

import java.util.List;
import java.util.Objects;

/**
 * A namespace with its declarations in stable order.
 *
 * @param fqn namespace FQN; empty for the root namespace
 * @param datasource {@code @datasource} name, or null
 * @param annotations namespace annotations
 * @param declarations tables, enums and embeds in declaration order
 * @param doc doc comment, or null
 */
public record NamespaceIr(
    String fqn,
    String datasource,
    List<Annotation> annotations,
    List<DeclarationRef> declarations,
    String doc
) {
    public NamespaceIr {
        Objects.requireNonNull(fqn, "fqn must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
    }

    public List<String> tables() {
        return ofKind(DefinitionKind.TABLE);
    }

    public List<String> enums() {
        return ofKind(DefinitionKind.ENUM);
    }

    public List<String> embeds() {
        return ofKind(DefinitionKind.EMBED);
    }

    private List<String> ofKind(DefinitionKind kind) {
        return declarations.stream()
            .filter(d -> d.kind() == kind)
            .map(DeclarationRef::fqn)
            .toList();
    }
}
