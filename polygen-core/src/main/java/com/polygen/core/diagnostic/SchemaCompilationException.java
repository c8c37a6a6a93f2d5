package com.polygen.core.diagnostic;

/**
 * Base type for exceptions raised while turning schema text into an AST.
 */
public class SchemaCompilationException extends RuntimeException {

    private final SourceLocation location;

    public SchemaCompilationException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
