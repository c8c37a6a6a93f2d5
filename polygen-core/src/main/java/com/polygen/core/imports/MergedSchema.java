package com.polygen.core.imports;

import com.polygen.core.ast.SchemaFile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All files of a compilation merged into one namespace tree.
 *
 * @param namespaces namespaces by first appearance; the root namespace comes first
 * @param files per-file ASTs in visitation order
 */
public record MergedSchema(
    List<MergedNamespace> namespaces,
    List<SchemaFile> files
) {
    public MergedSchema {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        namespaces = List.copyOf(namespaces);
        files = files != null ? List.copyOf(files) : List.of();
    }

    public Optional<MergedNamespace> namespace(String fqn) {
        return namespaces.stream()
            .filter(ns -> ns.fqn().equals(fqn))
            .findFirst();
    }
}
