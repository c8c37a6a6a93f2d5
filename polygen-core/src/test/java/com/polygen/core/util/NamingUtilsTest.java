package com.polygen.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link NamingUtils}.
 */
class NamingUtilsTest {

    @Test
    void toPascalCase_convertsSnakeCase() {
        assertThat(NamingUtils.toPascalCase("drop_items")).isEqualTo("DropItems");
        assertThat(NamingUtils.toPascalCase("dropItems")).isEqualTo("DropItems");
    }

    @Test
    void toLowerCamel_lowersFirstLetter() {
        assertThat(NamingUtils.toLowerCamel("PlayerSkills")).isEqualTo("playerSkills");
        assertThat(NamingUtils.toLowerCamel("")).isEmpty();
    }

    @Test
    void pluralize_appliesRegularSuffixRules() {
        assertThat(NamingUtils.pluralize("Category")).isEqualTo("Categories");
        assertThat(NamingUtils.pluralize("Day")).isEqualTo("Days");
        assertThat(NamingUtils.pluralize("Box")).isEqualTo("Boxes");
        assertThat(NamingUtils.pluralize("Match")).isEqualTo("Matches");
        assertThat(NamingUtils.pluralize("PlayerSkill")).isEqualTo("PlayerSkills");
    }

    @Test
    void qualify_handlesRootNamespace() {
        assertThat(NamingUtils.qualify("", "Player")).isEqualTo("Player");
        assertThat(NamingUtils.qualify("game", "Player")).isEqualTo("game.Player");
    }

    @Test
    void parentOf_andSimpleName_splitOnLastDot() {
        assertThat(NamingUtils.parentOf("game.item.Item")).isEqualTo("game.item");
        assertThat(NamingUtils.parentOf("Item")).isEmpty();
        assertThat(NamingUtils.simpleName("game.item.Item")).isEqualTo("Item");
    }
}
