package com.polygen.core.ir;

import java.util.List;
import java.util.Objects;

/**
 * An index over one or more fields of a table.
 *
 * @param name index name
 * @param fields indexed fields in order
 * @param unique whether the index enforces uniqueness
 * @param source what declared the index
 */
public record IndexSpec(
    String name,
    List<String> fields,
    boolean unique,
    Source source
) {
    public enum Source { PRIMARY_KEY, UNIQUE, INDEX, FOREIGN_KEY, ANNOTATION }

    public IndexSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        fields = List.copyOf(fields);
    }
}
