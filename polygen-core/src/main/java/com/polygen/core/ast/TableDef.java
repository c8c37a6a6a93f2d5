package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A table declaration.
 *
 * @param name table name
 * @param annotations table annotations
 * @param fields fields in declaration order
 * @param nestedTypes enums and embeds scoped to the table
 * @param doc doc comment or null
 * @param location source position
 */
public record TableDef(
    String name,
    List<Annotation> annotations,
    List<FieldDef> fields,
    List<Definition> nestedTypes,
    String doc,
    SourceLocation location
) implements Definition, FieldContainer {

    public TableDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        fields = fields != null ? List.copyOf(fields) : List.of();
        nestedTypes = nestedTypes != null ? List.copyOf(nestedTypes) : List.of();
    }

    @Override
    public DefinitionKind definitionKind() {
        return DefinitionKind.TABLE;
    }
}
