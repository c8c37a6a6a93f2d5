package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;

import java.util.List;
import java.util.Objects;

/**
 * An embed of the resolved schema.
 *
 * @param fqn fully qualified name; synthetic for inline embeds
 * @param name declared name, or the PascalCase field name for inline embeds
 * @param kind classification by declaration site
 * @param namespace FQN of the owning namespace
 * @param ownerFqn enclosing table or embed, or null for reusable embeds
 * @param fields fields in declaration order
 * @param nestedEnums FQNs of enums declared in the body
 * @param nestedEmbeds FQNs of embeds declared in the body
 * @param annotations embed annotations
 * @param doc doc comment, or null
 */
public record EmbedIr(
    String fqn,
    String name,
    EmbedKind kind,
    String namespace,
    String ownerFqn,
    List<FieldIr> fields,
    List<String> nestedEnums,
    List<String> nestedEmbeds,
    List<Annotation> annotations,
    String doc
) {
    public EmbedIr {
        Objects.requireNonNull(fqn, "fqn must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        nestedEnums = nestedEnums != null ? List.copyOf(nestedEnums) : List.of();
        nestedEmbeds = nestedEmbeds != null ? List.copyOf(nestedEmbeds) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }
}
