package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;
import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A table of the resolved schema.
 *
 * @param fqn fully qualified name
 * @param name simple name
 * @param namespace FQN of the owning namespace
 * @param fields fields in declaration order
 * @param nestedEnums FQNs of enums declared in the table body
 * @param nestedEmbeds FQNs of embeds declared in the table body
 * @param annotations table annotations, interpreted or not
 * @param options interpreted annotation effects
 * @param indexes indexes from key constraints and {@code @index}
 * @param doc doc comment, or null
 * @param location declaration position
 */
public record TableIr(
    String fqn,
    String name,
    String namespace,
    List<FieldIr> fields,
    List<String> nestedEnums,
    List<String> nestedEmbeds,
    List<Annotation> annotations,
    TableOptions options,
    List<IndexSpec> indexes,
    String doc,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public TableIr {
        Objects.requireNonNull(fqn, "fqn must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
        nestedEnums = nestedEnums != null ? List.copyOf(nestedEnums) : List.of();
        nestedEmbeds = nestedEmbeds != null ? List.copyOf(nestedEmbeds) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        indexes = indexes != null ? List.copyOf(indexes) : List.of();
        if (options == null) {
            options = TableOptions.none();
        }
    }

    public Optional<FieldIr> field(String fieldName) {
        return fields.stream()
            .filter(f -> f.name().equals(fieldName))
            .findFirst();
    }

    public Optional<FieldIr> primaryKey() {
        return fields.stream()
            .filter(FieldIr::isPrimaryKey)
            .findFirst();
    }
}
