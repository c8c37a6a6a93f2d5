package com.polygen.core.ir;

import com.polygen.core.SchemaFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for relationship and junction inference.
 */
class RelationshipInferrerTest {

    private static RelationshipIr relationship(SchemaIr ir, String table, String field) {
        return ir.relationshipsFrom(table).stream()
            .filter(r -> r.sourceField().equals(field))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void relationships_forwardMultiplicityFollowsFieldCardinality() {
        SchemaIr ir = SchemaFixtures.ir("""
            table User { id: u32 primary_key; }
            table Post {
                id: u32 primary_key;
                author_id: u32 foreign_key(User.id) as authoredPosts;
                editor_id: u32? foreign_key(User.id) as editedPosts;
                reviewer_ids: u32[] foreign_key(User.id) as reviewedPosts;
            }
            """);

        assertThat(relationship(ir, "Post", "author_id").forward()).isEqualTo(Multiplicity.ONE);
        assertThat(relationship(ir, "Post", "editor_id").forward()).isEqualTo(Multiplicity.ZERO_OR_ONE);
        assertThat(relationship(ir, "Post", "reviewer_ids").forward()).isEqualTo(Multiplicity.MANY);
    }

    @Test
    void relationships_explicitNameLabelsReverseEdge() {
        SchemaIr ir = SchemaFixtures.ir(SchemaFixtures.GAME);

        RelationshipIr users = relationship(ir, "game.PlayerSkill", "skill_id");
        assertThat(users.targetTable()).isEqualTo("game.Skill");
        assertThat(users.reverseName()).isEqualTo("users");
        assertThat(users.explicitName()).isTrue();
        assertThat(users.reverse()).isEqualTo(Multiplicity.MANY);
        assertThat(ir.relationshipsTo("game.Skill")).containsExactly(users);
    }

    @Test
    void relationships_defaultReverseNameIsPluralOfSource() {
        SchemaIr ir = SchemaFixtures.ir(SchemaFixtures.GAME);

        assertThat(relationship(ir, "game.PlayerSkill", "player_id").reverseName()).isEqualTo("playerSkills");
        assertThat(relationship(ir, "game.Player", "guild_id").reverseName()).isEqualTo("players");
    }

    @Test
    void relationships_severalUnnamedKeysToSameTarget_areQualifiedByField() {
        SchemaIr ir = SchemaFixtures.ir("""
            table User { id: u32 primary_key; }
            table Message {
                id: u32 primary_key;
                sender_id: u32 foreign_key(User.id);
                receiver_id: u32 foreign_key(User.id);
            }
            """);

        assertThat(ir.relationshipsFrom("Message")).extracting(RelationshipIr::reverseName)
            .containsExactly("messagesBySenderId", "messagesByReceiverId");
    }

    @Test
    void relationships_uniqueForeignKey_hasReverseMultiplicityOne() {
        SchemaIr ir = SchemaFixtures.ir("""
            table User { id: u32 primary_key; }
            table Profile { id: u32 primary_key; user_id: u32 unique foreign_key(User.id); }
            """);

        assertThat(relationship(ir, "Profile", "user_id").reverse()).isEqualTo(Multiplicity.ONE);
    }

    @Test
    void relationships_selfReference_isDetected() {
        SchemaIr ir = SchemaFixtures.ir("""
            table Category { id: u32 primary_key; parent_id: u32? foreign_key(Category.id) as children; }
            """);

        RelationshipIr parent = relationship(ir, "Category", "parent_id");
        assertThat(parent.isSelfReference()).isTrue();
        assertThat(parent.reverseName()).isEqualTo("children");
    }

    @Test
    void junctions_tableWithTwoForeignKeys_isManyToMany() {
        SchemaIr ir = SchemaFixtures.ir(SchemaFixtures.GAME);

        assertThat(ir.manyToMany()).containsExactly(
            new ManyToManyIr("game.PlayerSkill", "game.Player", "player_id", "game.Skill", "skill_id"));
        assertThat(ir.tables()).containsKey("game.PlayerSkill");
    }

    @Test
    void junctions_twoKeysToSameTable_isNotManyToMany() {
        SchemaIr ir = SchemaFixtures.ir("""
            table User { id: u32 primary_key; }
            table Friendship { a_id: u32 foreign_key(User.id); b_id: u32 foreign_key(User.id); }
            """);

        assertThat(ir.manyToMany()).isEmpty();
    }

    @Test
    void junctions_arrayForeignKey_isNotManyToMany() {
        SchemaIr ir = SchemaFixtures.ir("""
            table A { id: u32 primary_key; }
            table B { id: u32 primary_key; }
            table Link { a_id: u32 foreign_key(A.id); b_ids: u32[] foreign_key(B.id); }
            """);

        assertThat(ir.manyToMany()).isEmpty();
    }

    @Test
    void defaultReverseName_pluralizesRegularNouns() {
        assertThat(RelationshipInferrer.defaultReverseName("Category", "parent_id", false)).isEqualTo("categories");
        assertThat(RelationshipInferrer.defaultReverseName("Box", "owner_id", false)).isEqualTo("boxes");
        assertThat(RelationshipInferrer.defaultReverseName("Message", "sender_id", true)).isEqualTo("messagesBySenderId");
    }
}
