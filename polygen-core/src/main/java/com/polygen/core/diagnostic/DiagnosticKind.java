package com.polygen.core.diagnostic;

/**
 * Closed taxonomy of problems the compiler reports.
 *
 * <p>The display name is the stable identifier printed in diagnostics and used by tools
 * that post-process compiler output.
 */
public enum DiagnosticKind {
    SYNTAX_ERROR("SyntaxError", Severity.ERROR),
    CIRCULAR_IMPORT("CircularImportError", Severity.ERROR),
    IMPORT_NOT_FOUND("ImportNotFoundError", Severity.ERROR),
    DUPLICATE_DEFINITION("DuplicateDefinitionError", Severity.ERROR),
    UNRESOLVED_TYPE("UnresolvedTypeError", Severity.ERROR),
    UNRESOLVED_FOREIGN_KEY("UnresolvedForeignKeyError", Severity.ERROR),
    CONSTRAINT_TYPE_MISMATCH("ConstraintTypeMismatchError", Severity.ERROR),
    MISSING_ANNOTATION_PARAMETER("MissingAnnotationParameterError", Severity.ERROR),
    INVALID_ANNOTATION_PARAMETER("InvalidAnnotationParameterError", Severity.ERROR),
    INVALID_PRIMARY_KEY("InvalidPrimaryKeyError", Severity.ERROR),
    EMPTY_TABLE("EmptyTableWarning", Severity.WARNING),
    DUPLICATE_ENUM_VALUE("DuplicateEnumValueWarning", Severity.WARNING);

    private final String displayName;
    private final Severity defaultSeverity;

    DiagnosticKind(String displayName, Severity defaultSeverity) {
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
    }

    public String displayName() {
        return displayName;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
