package com.polygen.core.imports;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SourceLocation;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ImportResolver}.
 */
class ImportResolverTest {

    @Test
    void resolve_followsRelativeImports() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("schemas/main.poly", """
                import "game/player.poly";
                namespace game { table Guild { id: u32 primary_key; } }
                """)
            .add("schemas/game/player.poly", """
                import "../common.poly";
                namespace game { table Player { id: u32 primary_key; } }
                """)
            .add("schemas/common.poly", "namespace common { enum Element { Fire, Water } }");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("schemas/main.poly"));

        assertThat(result.isSuccess()).isTrue();
        MergedSchema merged = result.mergedSchema().orElseThrow();
        assertThat(merged.files()).hasSize(3);
        assertThat(merged.namespace("game")).hasValueSatisfying(ns ->
            assertThat(ns.types()).extracting(d -> d.name()).containsExactly("Guild", "Player"));
        assertThat(merged.namespace("common")).isPresent();
    }

    @Test
    void resolve_withSharedImport_loadsFileOnce() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("main.poly", "import \"a.poly\"; import \"b.poly\";")
            .add("a.poly", "import \"common.poly\"; table A { id: u32 primary_key; }")
            .add("b.poly", "import \"common.poly\"; table B { id: u32 primary_key; }")
            .add("common.poly", "table Common { id: u32 primary_key; }");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("main.poly"));

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.mergedSchema().orElseThrow().files()).hasSize(4);
    }

    @Test
    void resolve_withCycle_reportsCircularImportOnce() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("a.poly", "import \"b.poly\";")
            .add("b.poly", "import \"c.poly\";")
            .add("c.poly", "import \"a.poly\";");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("a.poly"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.CIRCULAR_IMPORT);
            assertThat(d.message()).contains("a.poly -> b.poly -> c.poly -> a.poly");
            assertThat(d.location().file()).isEqualTo("c.poly");
        });
    }

    @Test
    void resolve_withSelfImport_reportsCycle() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("self.poly", "import \"self.poly\"; table T { id: u32 primary_key; }");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("self.poly"));

        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.CIRCULAR_IMPORT);
    }

    @Test
    void resolve_withMissingImport_reportsImportNotFound() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("main.poly", "import \"missing.poly\";");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("main.poly"));

        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.IMPORT_NOT_FOUND);
            assertThat(d.location()).isEqualTo(new SourceLocation("main.poly", 1, 1));
        });
    }

    @Test
    void resolve_withMissingEntry_reportsImportNotFound() {
        ResolutionResult result = new ImportResolver(new InMemorySourceReader()).resolve(Path.of("nope.poly"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.IMPORT_NOT_FOUND);
    }

    @Test
    void resolve_withSyntaxErrorInImportedFile_reportsSyntaxError() {
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("main.poly", "import \"broken.poly\";")
            .add("broken.poly", "table Broken {");

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("main.poly"));

        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.SYNTAX_ERROR);
            assertThat(d.location().file()).isEqualTo("broken.poly");
        });
    }

    @Test
    void resolve_withSameTableInTwoFiles_reportsDuplicateCitingBoth() {
        String item = "namespace game.item { table Item { id: u32 primary_key; } }";
        InMemorySourceReader reader = new InMemorySourceReader()
            .add("main.poly", "import \"a.poly\"; import \"b.poly\";")
            .add("a.poly", item)
            .add("b.poly", item);

        ResolutionResult result = new ImportResolver(reader).resolve(Path.of("main.poly"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DEFINITION);
            assertThat(d.message()).contains("game.item.Item");
            assertThat(d.location().file()).isEqualTo("b.poly");
            assertThat(d.related()).extracting(SourceLocation::file).containsExactly("a.poly");
        });
    }
}
