package com.polygen.core.ir;

import java.util.Objects;

/**
 * @param name variant name
 * @param value explicit or implicit integer value
 * @param doc doc comment, or null
 */
public record EnumValueIr(
    String name,
    long value,
    String doc
) {
    public EnumValueIr {
        Objects.requireNonNull(name, "name must not be null");
    }
}
