package com.polygen.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST of one schema file.
 *
 * @param path normalized file path
 * @param imports file imports in source order
 * @param definitions top-level definitions in source order
 */
public record SchemaFile(
    String path,
    List<FileImport> imports,
    List<Definition> definitions
) {
    public SchemaFile {
        Objects.requireNonNull(path, "path must not be null");
        imports = imports != null ? List.copyOf(imports) : List.of();
        definitions = definitions != null ? List.copyOf(definitions) : List.of();
    }
}
