package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.Objects;

/**
 * {@code import a.b.*;} or {@code import a.b.Type;} inside a namespace body.
 *
 * @param path imported namespace (wildcard) or type path
 * @param wildcard true for {@code .*} imports
 * @param location source position
 */
public record NamespaceImport(
    String path,
    boolean wildcard,
    SourceLocation location
) {
    public NamespaceImport {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }
}
