package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An enum of the resolved schema.
 *
 * @param fqn fully qualified name; synthetic for inline enums
 * @param name declared or synthesized name
 * @param namespace FQN of the owning namespace
 * @param ownerFqn enclosing table or embed, or null at namespace level
 * @param inline true for enums declared as a field's type
 * @param values variants with resolved values, in declaration order
 * @param annotations enum annotations
 * @param doc doc comment, or null
 */
public record EnumIr(
    String fqn,
    String name,
    String namespace,
    String ownerFqn,
    boolean inline,
    List<EnumValueIr> values,
    List<Annotation> annotations,
    String doc
) {
    public EnumIr {
        Objects.requireNonNull(fqn, "fqn must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        values = values != null ? List.copyOf(values) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }

    public Optional<EnumValueIr> value(String variantName) {
        return values.stream()
            .filter(v -> v.name().equals(variantName))
            .findFirst();
    }
}
