package com.polygen.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ProjectConfig}.
 */
class ProjectConfigTest {

    @Test
    void defaults_enablesBundledGenerators() {
        ProjectConfig config = ProjectConfig.defaults();

        assertThat(config.generators().enabled()).containsExactly("mermaid", "json-ir", "markdown");
        assertThat(config.schema()).isNull();
        assertThat(config.validation().toOptions().allowCompositePrimaryKeys()).isFalse();
    }

    @Test
    void generatorSettings_withEmptyList_enablesEverything() {
        ProjectConfig.GeneratorSettings settings = new ProjectConfig.GeneratorSettings(List.of(), null, null, null);

        assertThat(settings.isEnabled("anything")).isTrue();
        assertThat(settings.settings()).isEmpty();
    }

    @Test
    void generatorSettings_passesCustomSettingsToGenerators() {
        ProjectConfig.GeneratorSettings settings =
            new ProjectConfig.GeneratorSettings(null, "forest", "  ", Map.of("markdown.title", "Game Data", "json-ir.pretty", false));

        assertThat(settings.toGeneratorConfig().theme()).isEqualTo("forest");
        assertThat(settings.toGeneratorConfig().namespaceFilter()).isNull();
        assertThat(settings.toGeneratorConfig().setting("markdown.title", "Schema Reference")).isEqualTo("Game Data");
        assertThat(settings.toGeneratorConfig().flag("json-ir.pretty", true)).isFalse();
        assertThat(settings.toGeneratorConfig().flag("mermaid.direction", true)).isTrue();
    }

    @Test
    void outputConfig_withNullClean_isNotClean() {
        assertThat(new ProjectConfig.OutputConfig("out", null).isClean()).isFalse();
    }
}
