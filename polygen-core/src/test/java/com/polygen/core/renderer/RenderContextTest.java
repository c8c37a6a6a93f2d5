package com.polygen.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RenderContextTest {

    @Test
    void constructor_withNullDirectory_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("outputDirectory");
    }

    @Test
    void flag_readsBooleanSettings() {
        RenderContext context = new RenderContext("out", Map.of("filesystem.clean", " TRUE ", "console.colors", "no"));

        assertThat(context.flag("filesystem.clean", false)).isTrue();
        assertThat(context.flag("console.colors", true)).isFalse();
        assertThat(context.flag("console.showHeaders", true)).isTrue();
    }

    @Test
    void setting_fallsBackToDefault() {
        RenderContext context = new RenderContext("out", null);

        assertThat(context.setting("console.separator", "---")).isEqualTo("---");
    }

    @Test
    void settings_areCopied() {
        Map<String, String> settings = new HashMap<>(Map.of("filesystem.clean", "true"));
        RenderContext context = new RenderContext("out", settings);

        settings.put("filesystem.clean", "false");

        assertThat(context.flag("filesystem.clean", false)).isTrue();
    }
}
