package com.polygen.core.diagnostic;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A user-facing problem found while compiling a schema.
 *
 * @param kind problem category
 * @param severity error or warning
 * @param message human-readable description
 * @param location primary source position
 * @param related secondary positions (e.g. the first declaration of a duplicate)
 */
public record Diagnostic(
    DiagnosticKind kind,
    Severity severity,
    String message,
    SourceLocation location,
    List<SourceLocation> related
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (severity == null) {
            severity = kind.defaultSeverity();
        }
        related = related != null ? List.copyOf(related) : List.of();
    }

    /**
     * Creates a diagnostic with the kind's default severity.
     *
     * @param kind problem category
     * @param message description
     * @param location primary position
     * @param related secondary positions
     * @return new diagnostic
     */
    public static Diagnostic of(DiagnosticKind kind, String message, SourceLocation location, SourceLocation... related) {
        return new Diagnostic(kind, kind.defaultSeverity(), message, location, List.of(related));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Returns a copy of this diagnostic with the given severity.
     *
     * @param newSeverity severity to apply
     * @return diagnostic with the new severity
     */
    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(kind, newSeverity, message, location, related);
    }

    /**
     * Checks whether any diagnostic in the collection is an error.
     *
     * @param diagnostics diagnostics to inspect
     * @return true if at least one error is present
     */
    public static boolean hasErrors(Collection<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
