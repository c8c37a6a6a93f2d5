package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.Objects;

/**
 * {@code import "path";} at file level.
 *
 * @param path import path relative to the importing file
 * @param location source position
 */
public record FileImport(
    String path,
    SourceLocation location
) {
    public FileImport {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }
}
