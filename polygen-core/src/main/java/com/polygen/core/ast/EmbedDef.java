package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An embed declaration, named or anonymous.
 *
 * <p>Anonymous embeds come from {@code field: embed { ... }} and carry the PascalCase
 * form of the field name.
 *
 * @param name declared or synthesized name
 * @param annotations embed annotations
 * @param fields fields in declaration order
 * @param nestedTypes enums and embeds scoped to the embed
 * @param anonymous true for inline embeds
 * @param doc doc comment or null
 * @param location source position
 */
public record EmbedDef(
    String name,
    List<Annotation> annotations,
    List<FieldDef> fields,
    List<Definition> nestedTypes,
    boolean anonymous,
    String doc,
    SourceLocation location
) implements Definition, FieldContainer {

    public EmbedDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        fields = fields != null ? List.copyOf(fields) : List.of();
        nestedTypes = nestedTypes != null ? List.copyOf(nestedTypes) : List.of();
    }

    @Override
    public DefinitionKind definitionKind() {
        return DefinitionKind.EMBED;
    }
}
