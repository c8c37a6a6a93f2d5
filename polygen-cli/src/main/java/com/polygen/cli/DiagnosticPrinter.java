package com.polygen.cli;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticFormatter;
import com.polygen.core.pipeline.CompilationResult;

import java.io.PrintWriter;

/**
 * Prints compilation diagnostics and a one-line summary.
 */
final class DiagnosticPrinter {

    private DiagnosticPrinter() {
    }

    static void print(CompilationResult result, PrintWriter out, PrintWriter err) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            (diagnostic.isError() ? err : out).println(DiagnosticFormatter.format(diagnostic));
        }
        int errors = result.errors().size();
        int warnings = result.warnings().size();
        if (errors > 0) {
            err.printf("✗ %d error(s), %d warning(s)%n", errors, warnings);
        } else if (warnings > 0) {
            out.printf("⚠ %d warning(s)%n", warnings);
        }
        out.flush();
        err.flush();
    }
}
