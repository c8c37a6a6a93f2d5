package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * @param name variant name
 * @param annotations variant annotations
 * @param value explicit value, or null when implicit
 * @param doc doc comment or null
 * @param location source position
 */
public record EnumVariant(
    String name,
    List<Annotation> annotations,
    Long value,
    String doc,
    SourceLocation location
) {
    public EnumVariant {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }
}
