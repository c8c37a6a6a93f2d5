package com.polygen.core.validation;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SourceLocation;
import com.polygen.core.imports.MergedSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State shared by the validation rules of one run.
 */
public final class ValidationContext {

    private final MergedSchema schema;
    private final SymbolTable symbols;
    private final ValidationOptions options;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ValidationContext(MergedSchema schema, SymbolTable symbols, ValidationOptions options) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public MergedSchema schema() {
        return schema;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public ValidationOptions options() {
        return options;
    }

    public void report(DiagnosticKind kind, String message, SourceLocation location, SourceLocation... related) {
        diagnostics.add(Diagnostic.of(kind, message, location, related));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
