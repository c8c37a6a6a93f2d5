package com.polygen.core.imports;

import com.polygen.core.diagnostic.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of import resolution.
 *
 * @param merged merged schema; null when any diagnostic was reported
 * @param diagnostics syntax, import and merge problems
 */
public record ResolutionResult(
    MergedSchema merged,
    List<Diagnostic> diagnostics
) {
    public ResolutionResult {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public Optional<MergedSchema> mergedSchema() {
        return Optional.ofNullable(merged);
    }

    public boolean isSuccess() {
        return merged != null;
    }
}
