package com.polygen.core.generator.impl;

import com.polygen.core.SchemaFixtures;
import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.ir.SchemaIr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private static final String MONSTER = """
        namespace game {
            embed Position { x: f32; y: f32; }
            table Monster {
                id: u32 primary_key;
                position: Position;
                drop_items: embed { item_id: u32; drop_chance: f32; }[];
                nickname: string?;
            }
        }
        """;

    private MermaidGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
        assertThat(generator.getFileExtension()).isEqualTo("md");
        assertThat(generator.getSupportedArtifactTypes())
            .containsExactlyInAnyOrder(ArtifactType.CLASS_DIAGRAM, ArtifactType.ER_DIAGRAM);
    }

    @Test
    void generate_withUnsupportedType_throwsException() {
        SchemaIr ir = SchemaFixtures.ir(SchemaFixtures.GAME);

        assertThatThrownBy(() -> generator.generate(ir, ArtifactType.IR_DUMP, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported artifact type");
    }

    @Test
    void generate_withNullSchema_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, ArtifactType.CLASS_DIAGRAM, config))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_classDiagram_containsTablesAndAssociations() {
        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.CLASS_DIAGRAM, config);

        assertThat(artifact.fileName()).isEqualTo("class-diagram.md");
        assertThat(artifact.content())
            .startsWith("# Class Diagram\n\n```mermaid\nclassDiagram\n")
            .contains("class game_Player[\"Player\"] {")
            .contains("<<table>>")
            .contains("+u32 id PK")
            .contains("+u32? guild_id")
            .contains("<<enumeration>>")
            .contains("game_PlayerSkill \"1\" --> \"1\" game_Skill : skill_id")
            .contains("game_Skill \"1\" -- \"*\" game_PlayerSkill : users")
            .endsWith("```\n");
    }

    @Test
    void generate_classDiagram_omitsInlineEmbeds() {
        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(MONSTER), ArtifactType.CLASS_DIAGRAM, config);

        assertThat(artifact.content())
            .contains("class game_Position[\"Position\"] {")
            .contains("+List~drop_items~ drop_items")
            .contains("game_Monster *-- \"1\" game_Position : position")
            .doesNotContain("class game_Monster_drop_items")
            .doesNotContain("*-- \"*\" game_Monster_drop_items");
    }

    @Test
    void generate_classDiagram_withoutEnums_omitsEnumClasses() {
        GeneratorConfig noEnums = new GeneratorConfig(null, false, null, Map.of());

        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.CLASS_DIAGRAM, noEnums);

        assertThat(artifact.content()).doesNotContain("<<enumeration>>");
    }

    @Test
    void generate_withTheme_addsInitDirective() {
        GeneratorConfig dark = new GeneratorConfig("dark", true, null, Map.of());

        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.ER_DIAGRAM, dark);

        assertThat(artifact.content()).contains("%%{init: {'theme': 'dark'}}%%\nerDiagram\n");
    }

    @Test
    void generate_erDiagram_marksKeysAndRelationships() {
        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.ER_DIAGRAM, config);

        assertThat(artifact.fileName()).isEqualTo("er-diagram.md");
        assertThat(artifact.content())
            .contains("game_Player {")
            .contains("u32 id PK")
            .contains("string name UK")
            .contains("u32 guild_id FK")
            .contains("game_Guild |o--o{ game_Player : \"players\"")
            .contains("game_Skill ||--o{ game_PlayerSkill : \"users\"");
    }

    @Test
    void generate_withEmptySchema_emitsPlaceholder() {
        SchemaIr empty = new SchemaIr(List.of(), Map.of(), Map.of(), Map.of(), List.of(), List.of());

        assertThat(generator.generate(empty, ArtifactType.CLASS_DIAGRAM, config).content()).contains("class Empty");
        assertThat(generator.generate(empty, ArtifactType.ER_DIAGRAM, config).content()).contains("PLACEHOLDER");
    }

    @Test
    void generate_withNamespaceFilter_skipsOtherNamespaces() {
        SchemaIr ir = SchemaFixtures.ir("""
            namespace game { table Player { id: u32 primary_key; } }
            namespace shop { table Offer { id: u32 primary_key; } }
            """);
        GeneratorConfig onlyGame = new GeneratorConfig(null, true, "game", Map.of());

        String content = generator.generate(ir, ArtifactType.CLASS_DIAGRAM, onlyGame).content();

        assertThat(content).contains("game_Player").doesNotContain("shop_Offer");
    }
}
