package com.polygen.core.pipeline;

import com.polygen.core.SchemaFixtures;
import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.ast.Constraint;
import com.polygen.core.imports.FileSystemSourceReader;
import com.polygen.core.imports.InMemorySourceReader;
import com.polygen.core.ir.EmbedKind;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.validation.ValidationOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CompilationPipeline}.
 */
class CompilationPipelineTest {

    @TempDir
    Path tempDir;

    @Test
    void compile_withValidSchema_producesIr() {
        CompilationResult result = SchemaFixtures.compile(SchemaFixtures.GAME);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.schemaIr()).hasValueSatisfying(ir -> assertThat(ir.tables()).hasSize(4));
    }

    @Test
    void compile_withErrors_producesNoIr() {
        CompilationResult result = SchemaFixtures.compile("table Player { id: u32 primary_key; home: Town; }");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.schemaIr()).isEmpty();
        assertThat(result.errors()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.UNRESOLVED_TYPE);
    }

    @Test
    void compile_withWarningsOnly_stillProducesIr() {
        CompilationResult result = SchemaFixtures.compile("""
            table Player { id: u32 primary_key; }
            table Nothing { }
            """);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.warnings()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.EMPTY_TABLE);
        assertThat(result.schemaIr()).isPresent();
    }

    @Test
    void compile_withWarningsAsErrors_producesNoIr() {
        CompilationResult result = SchemaFixtures.compile("table Nothing { }", new ValidationOptions(false, true));

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.schemaIr()).isEmpty();
    }

    @Test
    void validate_neverCarriesIr() {
        CompilationResult result = new CompilationPipeline(SchemaFixtures.reader(SchemaFixtures.MAIN, SchemaFixtures.GAME),
            ValidationOptions.defaults()).validate(Path.of(SchemaFixtures.MAIN));

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.schemaIr()).isEmpty();
    }

    @Test
    void compile_readsFilesFromDisk() throws IOException {
        Files.createDirectories(tempDir.resolve("game"));
        Files.writeString(tempDir.resolve("main.poly"), "import \"game/player.poly\";\n");
        Files.writeString(tempDir.resolve("game/player.poly"), "namespace game { table Player { id: u32 primary_key; } }\n");

        CompilationResult result = new CompilationPipeline(new FileSystemSourceReader(), ValidationOptions.defaults())
            .compile(tempDir.resolve("main.poly"));

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.schemaIr().orElseThrow().tables()).containsOnlyKeys("game.Player");
    }

    @Test
    void compile_withCrossFileDuplicate_reportsDuplicateDefinition() {
        String item = "namespace game.item { table Item { id: u32 primary_key; } }";
        CompilationResult result = new CompilationPipeline(
            SchemaFixtures.reader("main.poly", "import \"a.poly\"; import \"b.poly\";", "a.poly", item, "b.poly", item),
            ValidationOptions.defaults()).compile(Path.of("main.poly"));

        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DEFINITION);
            assertThat(d.location().file()).isEqualTo("b.poly");
            assertThat(d.related()).singleElement().satisfies(r -> assertThat(r.file()).isEqualTo("a.poly"));
        });
    }

    @Test
    void compile_schemaSplitAcrossImportedFiles_matchesSingleFile() {
        String guild = """
            namespace game {
                embed Position { x: f32; y: f32; }
                table Guild { id: u32 primary_key; name: string unique; }
            }
            """;
        String player = """
            namespace game {
                table Player {
                    id: u32 primary_key;
                    guild_id: u32? foreign_key(Guild.id);
                    home: Position;
                    loot: embed { item: string; count: u16; }[];
                }
                table Membership {
                    player_id: u32 foreign_key(Player.id);
                    guild_id: u32 foreign_key(Guild.id);
                }
            }
            """;

        SchemaIr single = compileIr(SchemaFixtures.reader("main.poly", guild + player));
        SchemaIr split = compileIr(SchemaFixtures.reader(
            "main.poly", "import \"player.poly\";",
            "player.poly", "import \"guild.poly\";\n" + player,
            "guild.poly", guild));

        assertThat(fieldsByTable(split)).isEqualTo(fieldsByTable(single));
        assertThat(embedKinds(split)).isEqualTo(embedKinds(single));
        assertThat(split.relationships()).containsExactlyInAnyOrderElementsOf(single.relationships());
        assertThat(split.manyToMany()).containsExactlyInAnyOrderElementsOf(single.manyToMany());
    }

    @Test
    void compile_embedClassification_isIndependentOfReferencingFileOrder() {
        String common = """
            embed Position { x: f32; y: f32; }
            table Zone { id: u32 primary_key; bounds: embed { w: f32; h: f32; }; }
            """;
        String npc = """
            import "common.poly";
            table Npc { id: u32 primary_key; position: Position; }
            """;
        String spawn = """
            import "common.poly";
            table Spawn {
                id: u32 primary_key;
                path: Position[];
                offset: Offset?;
                embed Offset { dx: f32; dy: f32; }
            }
            """;

        SchemaIr npcFirst = compileIr(SchemaFixtures.reader(
            "main.poly", "import \"npc.poly\"; import \"spawn.poly\";",
            "npc.poly", npc, "spawn.poly", spawn, "common.poly", common));
        SchemaIr spawnFirst = compileIr(SchemaFixtures.reader(
            "main.poly", "import \"spawn.poly\"; import \"npc.poly\";",
            "npc.poly", npc, "spawn.poly", spawn, "common.poly", common));

        assertThat(embedKinds(npcFirst))
            .containsEntry("Position", EmbedKind.REUSABLE)
            .containsEntry("Spawn.Offset", EmbedKind.NESTED_NAMED)
            .containsEntry("Zone.bounds", EmbedKind.INLINE)
            .isEqualTo(embedKinds(spawnFirst));
        assertThat(fieldsByTable(npcFirst)).isEqualTo(fieldsByTable(spawnFirst));
    }

    private static SchemaIr compileIr(InMemorySourceReader reader) {
        CompilationResult result = new CompilationPipeline(reader, ValidationOptions.defaults())
            .compile(Path.of("main.poly"));
        return result.schemaIr()
            .orElseThrow(() -> new AssertionError("Compilation failed: " + result.diagnostics()));
    }

    // Field shape without source locations, so layouts over different files compare equal.
    private static Map<String, List<String>> fieldsByTable(SchemaIr ir) {
        Map<String, List<String>> fields = new TreeMap<>();
        ir.tables().forEach((fqn, table) -> fields.put(fqn, table.fields().stream()
            .map(field -> field.name() + ":" + field.type() + ":"
                + field.constraints().stream().map(Constraint::kind).toList() + ":" + field.foreignKey())
            .toList()));
        return fields;
    }

    private static Map<String, EmbedKind> embedKinds(SchemaIr ir) {
        Map<String, EmbedKind> kinds = new TreeMap<>();
        ir.embeds().forEach((fqn, embed) -> kinds.put(fqn, embed.kind()));
        return kinds;
    }
}
