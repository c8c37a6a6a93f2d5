package com.polygen.core.parser;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SchemaCompilationException;
import com.polygen.core.diagnostic.SourceLocation;

/**
 * Raised at the first lexical or syntactic error in a schema file, or when a literal
 * cannot be converted while building the AST.
 */
public class SchemaSyntaxException extends SchemaCompilationException {

    private final String offendingToken;
    private final String expected;

    public SchemaSyntaxException(String message, SourceLocation location, String offendingToken, String expected) {
        super(message, location);
        this.offendingToken = offendingToken;
        this.expected = expected;
    }

    public SchemaSyntaxException(String message, SourceLocation location) {
        this(message, location, null, null);
    }

    public int getLine() {
        return getLocation().line();
    }

    public int getColumn() {
        return getLocation().column();
    }

    /**
     * Text of the token that triggered the error, if known.
     *
     * @return offending token text or null
     */
    public String getOffendingToken() {
        return offendingToken;
    }

    /**
     * Expected token set rendered as text, if known.
     *
     * @return expected tokens or null
     */
    public String getExpected() {
        return expected;
    }

    /**
     * Converts this exception into a {@link DiagnosticKind#SYNTAX_ERROR} diagnostic.
     *
     * @return diagnostic at the error position
     */
    public Diagnostic toDiagnostic() {
        return Diagnostic.of(DiagnosticKind.SYNTAX_ERROR, getMessage(), getLocation());
    }
}
