package com.polygen.core.validation;

/**
 * Switches that relax or tighten validation.
 *
 * @param allowCompositePrimaryKeys accept several {@code primary_key} fields on one table
 * @param warningsAsErrors report warnings with error severity
 */
public record ValidationOptions(
    boolean allowCompositePrimaryKeys,
    boolean warningsAsErrors
) {
    public static ValidationOptions defaults() {
        return new ValidationOptions(false, false);
    }
}
