package com.polygen.core.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, fully resolved schema consumed by generators.
 *
 * <p>Tables, enums and embeds form arenas keyed by FQN; relationships and junctions
 * refer to tables by FQN. Map iteration follows declaration order.
 *
 * @param namespaces namespaces in first-appearance order
 * @param tables tables by FQN
 * @param enums enums by FQN, inline enums included
 * @param embeds embeds by FQN, inline embeds included
 * @param relationships one edge per foreign key, in declaration order
 * @param manyToMany junction-table relations
 */
public record SchemaIr(
    List<NamespaceIr> namespaces,
    Map<String, TableIr> tables,
    Map<String, EnumIr> enums,
    Map<String, EmbedIr> embeds,
    List<RelationshipIr> relationships,
    List<ManyToManyIr> manyToMany
) {
    /**
     * Compact constructor with validation.
     */
    public SchemaIr {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        namespaces = List.copyOf(namespaces);
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        enums = Collections.unmodifiableMap(new LinkedHashMap<>(enums));
        embeds = Collections.unmodifiableMap(new LinkedHashMap<>(embeds));
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        manyToMany = manyToMany != null ? List.copyOf(manyToMany) : List.of();
    }

    public Optional<TableIr> table(String fqn) {
        return Optional.ofNullable(tables.get(fqn));
    }

    public Optional<EnumIr> enumType(String fqn) {
        return Optional.ofNullable(enums.get(fqn));
    }

    public Optional<EmbedIr> embed(String fqn) {
        return Optional.ofNullable(embeds.get(fqn));
    }

    public List<RelationshipIr> relationshipsFrom(String tableFqn) {
        return relationships.stream()
            .filter(r -> r.sourceTable().equals(tableFqn))
            .toList();
    }

    public List<RelationshipIr> relationshipsTo(String tableFqn) {
        return relationships.stream()
            .filter(r -> r.targetTable().equals(tableFqn))
            .toList();
    }
}
