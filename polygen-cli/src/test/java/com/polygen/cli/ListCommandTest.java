package com.polygen.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ListCommandTest {

    @Test
    void list_generators_printsBundledGenerators() {
        CliTestSupport.Run run = CliTestSupport.run("list", "generators");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("Available Generators:")
            .contains("(ID: mermaid)")
            .contains("(ID: json-ir)")
            .contains("(ID: markdown)");
    }

    @Test
    void list_renderers_printsRendererIds() {
        CliTestSupport.Run run = CliTestSupport.run("list", "renderers");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("  • filesystem").contains("  • console");
    }

    @Test
    void list_withUnknownType_fails() {
        CliTestSupport.Run run = CliTestSupport.run("list", "scanners");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("✗ Unknown type: scanners");
    }
}
