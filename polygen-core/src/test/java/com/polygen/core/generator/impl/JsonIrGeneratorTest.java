package com.polygen.core.generator.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polygen.core.SchemaFixtures;
import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.ir.SchemaIr;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link JsonIrGenerator}.
 */
class JsonIrGeneratorTest {

    private final JsonIrGenerator generator = new JsonIrGenerator();
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode dump(SchemaIr ir) throws Exception {
        GeneratedArtifact artifact = generator.generate(ir, ArtifactType.IR_DUMP, GeneratorConfig.defaults());
        return mapper.readTree(artifact.content());
    }

    @Test
    void generate_producesJsonWithFormatVersion() throws Exception {
        GeneratedArtifact artifact = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.IR_DUMP, GeneratorConfig.defaults());

        assertThat(artifact.fileName()).isEqualTo("ir-dump.json");
        assertThat(artifact.content()).endsWith("}\n");
        assertThat(mapper.readTree(artifact.content()).get("formatVersion").asText()).isEqualTo("1");
    }

    @Test
    void generate_includesTablesInDeclarationOrder() throws Exception {
        JsonNode root = dump(SchemaFixtures.ir(SchemaFixtures.GAME));

        List<String> fqns = new ArrayList<>();
        root.get("tables").forEach(t -> fqns.add(t.get("fqn").asText()));
        assertThat(fqns).containsExactly("game.Player", "game.Guild", "game.Skill", "game.PlayerSkill");
    }

    @Test
    void generate_includesRelationshipsAndJunctions() throws Exception {
        JsonNode root = dump(SchemaFixtures.ir(SchemaFixtures.GAME));

        JsonNode users = null;
        for (JsonNode rel : root.get("relationships")) {
            if (rel.get("sourceField").asText().equals("skill_id")) {
                users = rel;
            }
        }
        assertThat(users).isNotNull();
        assertThat(users.get("reverseName").asText()).isEqualTo("users");
        assertThat(users.get("forward").asText()).isEqualTo("1");
        assertThat(root.get("manyToMany")).hasSize(1);
        assertThat(root.get("manyToMany").get(0).get("junctionTable").asText()).isEqualTo("game.PlayerSkill");
    }

    @Test
    void generate_describesInlineEmbedKind() throws Exception {
        JsonNode root = dump(SchemaFixtures.ir("""
            table Monster { id: u32 primary_key; drop_items: embed { item_id: u32; }[]; }
            """));

        JsonNode embed = root.get("embeds").get(0);
        assertThat(embed.get("kind").asText()).isEqualTo("INLINE");
        assertThat(embed.get("owner").asText()).isEqualTo("Monster");
        JsonNode dropItems = root.get("tables").get(0).get("fields").get(1);
        assertThat(dropItems.get("type").get("modifier").asText()).isEqualTo("ARRAY");
        assertThat(dropItems.get("type").get("embedKind").asText()).isEqualTo("INLINE");
    }

    @Test
    void generate_sortsObjectKeys() {
        String content = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.IR_DUMP, GeneratorConfig.defaults()).content();

        assertThat(content.indexOf("\"embeds\"")).isLessThan(content.indexOf("\"enums\""));
        assertThat(content.indexOf("\"enums\"")).isLessThan(content.indexOf("\"formatVersion\""));
        assertThat(content.indexOf("\"relationships\"")).isLessThan(content.indexOf("\"tables\""));
    }

    @Test
    void generate_isByteStableAcrossRuns() {
        String first = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.IR_DUMP, GeneratorConfig.defaults()).content();
        String second = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.IR_DUMP, GeneratorConfig.defaults()).content();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_withUnsupportedType_throwsException() {
        assertThatThrownBy(() -> generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME),
            ArtifactType.ER_DIAGRAM, GeneratorConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generate_withPrettyDisabled_writesSingleLine() throws Exception {
        GeneratorConfig config = new GeneratorConfig(null, true, null, Map.of(JsonIrGenerator.PRETTY_SETTING, false));

        String content = generator.generate(SchemaFixtures.ir(SchemaFixtures.GAME), ArtifactType.IR_DUMP, config).content();

        assertThat(content.strip()).doesNotContain("\n");
        assertThat(mapper.readTree(content)).isEqualTo(dump(SchemaFixtures.ir(SchemaFixtures.GAME)));
    }
}
