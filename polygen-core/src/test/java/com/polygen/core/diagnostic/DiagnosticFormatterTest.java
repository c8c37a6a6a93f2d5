package com.polygen.core.diagnostic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DiagnosticFormatterTest {

    private static final SourceLocation HERE = new SourceLocation("game/player.poly", 4, 9);

    @Test
    void format_usesFileLineColumnLayout() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.UNRESOLVED_TYPE, "Unknown type 'Town'", HERE);

        assertThat(DiagnosticFormatter.format(diagnostic))
            .isEqualTo("game/player.poly:4:9: error[UnresolvedTypeError]: Unknown type 'Town'");
    }

    @Test
    void format_appendsRelatedLocationsAsNotes() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.DUPLICATE_DEFINITION, "'game.Player' is already defined",
            HERE, new SourceLocation("a.poly", 1, 1));

        assertThat(DiagnosticFormatter.format(diagnostic)).endsWith("\n    note: see a.poly:1:1");
    }

    @Test
    void format_withPromotedWarning_printsError() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.EMPTY_TABLE, "Table 'Nothing' has no fields", HERE)
            .withSeverity(Severity.ERROR);

        assertThat(DiagnosticFormatter.format(diagnostic)).contains("error[EmptyTableWarning]");
    }

    @Test
    void formatAll_joinsWithNewlines() {
        List<Diagnostic> diagnostics = List.of(
            Diagnostic.of(DiagnosticKind.EMPTY_TABLE, "first", HERE),
            Diagnostic.of(DiagnosticKind.DUPLICATE_ENUM_VALUE, "second", HERE));

        assertThat(DiagnosticFormatter.formatAll(diagnostics).lines())
            .containsExactly(
                "game/player.poly:4:9: warning[EmptyTableWarning]: first",
                "game/player.poly:4:9: warning[DuplicateEnumValueWarning]: second");
    }

    @Test
    void sourceLocation_clampsToFirstLineAndColumn() {
        assertThat(new SourceLocation("x.poly", 0, -3)).hasToString("x.poly:1:1");
    }
}
