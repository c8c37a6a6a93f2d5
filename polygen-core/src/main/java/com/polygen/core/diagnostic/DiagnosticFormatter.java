package com.polygen.core.diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats diagnostics in the conventional {@code file:line:column: severity[Kind]: message} layout.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {
        // Utility class
    }

    /**
     * Formats a single diagnostic. Related locations are appended as indented notes.
     *
     * @param diagnostic diagnostic to format
     * @return formatted text without trailing newline
     */
    public static String format(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.location()).append(": ")
            .append(diagnostic.severity().label())
            .append('[').append(diagnostic.kind().displayName()).append("]: ")
            .append(diagnostic.message());
        for (SourceLocation related : diagnostic.related()) {
            sb.append("\n    note: see ").append(related);
        }
        return sb.toString();
    }

    /**
     * Formats a list of diagnostics, one per line.
     *
     * @param diagnostics diagnostics to format
     * @return formatted text
     */
    public static String formatAll(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
            .map(DiagnosticFormatter::format)
            .collect(Collectors.joining("\n"));
    }
}
