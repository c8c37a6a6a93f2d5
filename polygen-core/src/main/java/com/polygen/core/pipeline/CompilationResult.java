package com.polygen.core.pipeline;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.ir.SchemaIr;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of compiling a schema.
 *
 * @param ir resolved schema; null when any error was reported or the run stopped after validation
 * @param diagnostics every diagnostic reported, errors and warnings, in stage order
 */
public record CompilationResult(
    SchemaIr ir,
    List<Diagnostic> diagnostics
) {
    public CompilationResult {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public Optional<SchemaIr> schemaIr() {
        return Optional.ofNullable(ir);
    }

    public boolean hasErrors() {
        return Diagnostic.hasErrors(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }
}
