package com.polygen.core.ast;

import java.util.Objects;

/**
 * A named ({@code key: value}) or positional argument of an annotation.
 *
 * @param key argument name, or null when positional
 * @param value argument value
 */
public record AnnotationArgument(
    String key,
    Literal value
) {
    public AnnotationArgument {
        Objects.requireNonNull(value, "value must not be null");
    }

    public boolean isPositional() {
        return key == null;
    }
}
