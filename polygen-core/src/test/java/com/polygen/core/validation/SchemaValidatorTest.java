package com.polygen.core.validation;

import com.polygen.core.SchemaFixtures;
import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SchemaValidator} and the default rule set.
 */
class SchemaValidatorTest {

    private static List<Diagnostic> validate(String text) {
        return validate(text, ValidationOptions.defaults());
    }

    private static List<Diagnostic> validate(String text, ValidationOptions options) {
        return new SchemaValidator(options).validate(SchemaFixtures.merge(text));
    }

    private static List<DiagnosticKind> kinds(String text) {
        return validate(text).stream().map(Diagnostic::kind).toList();
    }

    @Test
    void validate_withValidSchema_reportsNothing() {
        assertThat(validate(SchemaFixtures.GAME)).isEmpty();
    }

    @Test
    void validate_withUnknownFieldType_reportsUnresolvedType() {
        List<Diagnostic> diagnostics = validate("table Player { id: u32 primary_key; home: Town; }");

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_TYPE);
            assertThat(d.message()).contains("Town").contains("Player.home");
            assertThat(d.location().line()).isEqualTo(1);
        });
    }

    @Test
    void validate_resolvesNestedTypesBeforeNamespaceTypes() {
        assertThat(validate("""
            namespace game {
                enum Kind { A, B }
                table Item {
                    id: u32 primary_key;
                    kind: Kind;
                    enum Kind { X, Y }
                }
            }
            """)).isEmpty();
    }

    @Test
    void validate_resolvesTypesFromNamespaceImports() {
        assertThat(validate("""
            namespace common { enum Element { Fire, Water } }
            namespace game {
                import common.*;
                table Player { id: u32 primary_key; element: Element; }
            }
            """)).isEmpty();
    }

    @Test
    void validate_resolvesTypesFromParentNamespace() {
        assertThat(validate("""
            namespace game {
                enum Element { Fire, Water }
                namespace item {
                    table Item { id: u32 primary_key; element: Element; }
                }
            }
            """)).isEmpty();
    }

    @Test
    void validate_withDuplicateFieldInTable_reportsDuplicateDefinition() {
        assertThat(kinds("table Player { id: u32 primary_key; id: u64; }"))
            .containsExactly(DiagnosticKind.DUPLICATE_DEFINITION);
    }

    @Test
    void validate_withDuplicateTableInSameFile_reportsDuplicateDefinition() {
        assertThat(kinds("""
            table Item { id: u32 primary_key; }
            table Item { id: u32 primary_key; }
            """)).containsExactly(DiagnosticKind.DUPLICATE_DEFINITION);
    }

    @Test
    void validate_withMissingForeignKeyTable_reportsUnresolvedForeignKey() {
        assertThat(kinds("table Order { id: u32 primary_key; user_id: u32 foreign_key(User.id); }"))
            .containsExactly(DiagnosticKind.UNRESOLVED_FOREIGN_KEY);
    }

    @Test
    void validate_withMissingForeignKeyField_reportsUnresolvedForeignKey() {
        assertThat(kinds("""
            table User { id: u32 primary_key; }
            table Order { id: u32 primary_key; user_id: u32 foreign_key(User.uuid); }
            """)).containsExactly(DiagnosticKind.UNRESOLVED_FOREIGN_KEY);
    }

    @Test
    void validate_withForeignKeyTypeMismatch_reportsConstraintTypeMismatch() {
        assertThat(kinds("""
            table User { id: u32 primary_key; }
            table Order { id: u32 primary_key; user_id: string foreign_key(User.id); }
            """)).containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withForeignKeyInsideEmbed_reportsConstraintTypeMismatch() {
        assertThat(kinds("""
            table User { id: u32 primary_key; }
            embed Address { owner_id: u32 foreign_key(User.id); }
            """)).containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withMaxLengthOnInteger_reportsConstraintTypeMismatch() {
        assertThat(kinds("table Player { id: u32 primary_key max_length(10); }"))
            .containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withAutoIncrementOnString_reportsConstraintTypeMismatch() {
        assertThat(kinds("table Player { id: string primary_key auto_increment; }"))
            .containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withInvertedRange_reportsConstraintTypeMismatch() {
        assertThat(kinds("table Player { id: u32 primary_key; level: u8 range(10, 1); }"))
            .containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withUnknownEnumDefault_reportsConstraintTypeMismatch() {
        assertThat(kinds("""
            enum Element { Fire, Water }
            table Player { id: u32 primary_key; element: Element default(Air); }
            """)).containsExactly(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH);
    }

    @Test
    void validate_withCompositePrimaryKey_reportsInvalidPrimaryKey() {
        assertThat(kinds("table Membership { user_id: u32 primary_key; group_id: u32 primary_key; }"))
            .containsExactly(DiagnosticKind.INVALID_PRIMARY_KEY);
    }

    @Test
    void validate_withCompositePrimaryKeyAllowed_reportsNothing() {
        List<Diagnostic> diagnostics = validate(
            "table Membership { user_id: u32 primary_key; group_id: u32 primary_key; }",
            new ValidationOptions(true, false));

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void validate_withOptionalPrimaryKey_reportsInvalidPrimaryKey() {
        assertThat(kinds("table Player { id: u32? primary_key; }"))
            .containsExactly(DiagnosticKind.INVALID_PRIMARY_KEY);
    }

    @Test
    void validate_withLoadMissingType_reportsMissingAnnotationParameter() {
        assertThat(kinds("@load(path: \"x.csv\") table Player { id: u32 primary_key; }"))
            .containsExactly(DiagnosticKind.MISSING_ANNOTATION_PARAMETER);
    }

    @Test
    void validate_withMapLoadMissingPath_reportsMissingAnnotationParameter() {
        assertThat(kinds("@load(type: \"Map\") table Player { id: u32 primary_key; }"))
            .containsExactly(DiagnosticKind.MISSING_ANNOTATION_PARAMETER);
    }

    @Test
    void validate_withUnknownDataSourceType_reportsInvalidAnnotationParameter() {
        assertThat(kinds("@load(type: \"Ftp\", path: \"x\") table Player { id: u32 primary_key; }"))
            .containsExactly(DiagnosticKind.INVALID_ANNOTATION_PARAMETER);
    }

    @Test
    void validate_withPositionalPathAfterNamedType_reportsNothing() {
        assertThat(validate("@load(type: \"Map\", \"players.csv\") table Player { id: u32 primary_key; }"))
            .isEmpty();
    }

    @Test
    void validate_withPositionalLinkWithAfterNamedPartition_reportsNothing() {
        assertThat(validate("""
            @link_rows(partition_by: group_id, next_id)
            table Step { id: u32 primary_key; group_id: u32; next_id: u32?; }
            """)).isEmpty();
    }

    @Test
    void validate_withLinkRowsMissingPartition_reportsMissingAnnotationParameter() {
        List<Diagnostic> diagnostics = validate("""
            @link_rows(link_with: next_id)
            table Step { id: u32 primary_key; group_id: u32; next_id: u32?; }
            """);

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.MISSING_ANNOTATION_PARAMETER);
            assertThat(d.message()).isEqualTo("@link_rows requires parameter 'partition_by'");
        });
    }

    @Test
    void validate_withLinkRowsOnUnknownField_reportsInvalidAnnotationParameter() {
        List<Diagnostic> diagnostics = validate("""
            @link_rows(partition_by: group_id, link_with: previous_id)
            table Step { id: u32 primary_key; group_id: u32; next_id: u32?; }
            """);

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_ANNOTATION_PARAMETER);
            assertThat(d.message()).contains("link_with").contains("previous_id");
        });
    }

    @Test
    void validate_withSoftDeleteOnUnknownField_reportsInvalidAnnotationParameter() {
        List<Diagnostic> diagnostics = validate("""
            @soft_delete("removed_at")
            table Player { id: u32 primary_key; deleted_at: timestamp?; }
            """);

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_ANNOTATION_PARAMETER);
            assertThat(d.message()).contains("removed_at").contains("Player");
        });
    }

    @Test
    void validate_withInlineTypeNamedLikeNestedType_reportsDuplicateDefinition() {
        List<Diagnostic> diagnostics = validate("""
            table Player {
                id: u32 primary_key;
                Status: enum { A, B };
                mode: Status;
                enum Status { X, Y, Z }
            }
            """);

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DEFINITION);
            assertThat(d.message()).contains("Player.Status");
        });
    }

    @Test
    void validate_withIndexOnUnknownField_reportsInvalidAnnotationParameter() {
        assertThat(kinds("@index(\"nickname\") table Player { id: u32 primary_key; }"))
            .containsExactly(DiagnosticKind.INVALID_ANNOTATION_PARAMETER);
    }

    @Test
    void validate_withEmptyTable_reportsWarning() {
        List<Diagnostic> diagnostics = validate("table Nothing { }");

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.EMPTY_TABLE);
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
        });
    }

    @Test
    void validate_withWarningsAsErrors_promotesWarnings() {
        List<Diagnostic> diagnostics = validate("table Nothing { }", new ValidationOptions(false, true));

        assertThat(diagnostics).singleElement()
            .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR));
    }

    @Test
    void validate_withRepeatedEnumValue_reportsWarning() {
        assertThat(kinds("enum Element { Fire = 1, Water = 1 }"))
            .containsExactly(DiagnosticKind.DUPLICATE_ENUM_VALUE);
    }

    @Test
    void validate_reportsAllProblemsTogether() {
        assertThat(kinds("""
            table Player { id: u32 primary_key; home: Town; }
            table Order { id: u32 primary_key; user_id: u32 foreign_key(User.id); }
            """)).containsExactlyInAnyOrder(DiagnosticKind.UNRESOLVED_TYPE, DiagnosticKind.UNRESOLVED_FOREIGN_KEY);
    }
}
