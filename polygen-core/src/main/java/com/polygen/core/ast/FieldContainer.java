package com.polygen.core.ast;

import java.util.List;
import java.util.Optional;

/**
 * Common shape of tables and embeds: ordered fields plus nested enum/embed types.
 */
public interface FieldContainer {

    String name();

    List<FieldDef> fields();

    /**
     * Enums and embeds declared inside the body, in declaration order.
     *
     * @return nested definitions
     */
    List<Definition> nestedTypes();

    default Optional<FieldDef> field(String fieldName) {
        return fields().stream()
            .filter(f -> f.name().equals(fieldName))
            .findFirst();
    }
}
