package com.polygen.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private String config() {
        return tempDir.resolve("polygen.yaml").toString();
    }

    @Test
    void validate_withValidSchema_succeeds() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, "namespace game { table Player { id: u32 primary_key; name: string; } }\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ Schema is valid: " + schema);
        assertThat(run.err()).isEmpty();
    }

    @Test
    void validate_withUnresolvedType_printsDiagnosticAndFails() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, "table Player {\n    id: u32 primary_key;\n    home: Town;\n}\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err())
            .contains(":3:")
            .contains("error[UnresolvedTypeError]")
            .contains("✗ 1 error(s), 0 warning(s)");
    }

    @Test
    void validate_withWarningsOnly_succeeds() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, "table Player { id: u32 primary_key; }\ntable Nothing { }\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("warning[EmptyTableWarning]").contains("⚠ 1 warning(s)");
    }

    @Test
    void validate_withWarningsAsErrorsInConfig_fails() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, "table Nothing { }\n");
        Files.writeString(tempDir.resolve("polygen.yaml"), "validation:\n  warningsAsErrors: true\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("error[EmptyTableWarning]");
    }

    @Test
    void validate_withMissingFile_fails() {
        CliTestSupport.Run run = CliTestSupport.run("validate", tempDir.resolve("missing.poly").toString(), "-c", config());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("ImportNotFoundError");
    }

    @Test
    void validate_withCheckData_reportsKeyClashAcrossFiles() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, """
            @load(type: "Map", path: "data/players_*.csv")
            table Player { id: u32 primary_key; name: string; }
            """);
        Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(tempDir.resolve("data/players_a.csv"), "id,name\n7,Alice\n");
        Files.writeString(tempDir.resolve("data/players_b.csv"), "id,name\n7,Bob\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config(), "--check-data");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err())
            .contains("✗ Player: Duplicate key '7' found in files: 'data/players_a.csv' and 'data/players_b.csv'");
    }

    @Test
    void validate_withCheckData_countsLoadedRows() throws IOException {
        Path schema = tempDir.resolve("game.poly");
        Files.writeString(schema, """
            @load(type: "Map", path: "players.json")
            table Player { id: u32 primary_key; name: string; }
            """);
        Files.writeString(tempDir.resolve("players.json"), "[{\"id\": 1, \"name\": \"Alice\"}, {\"id\": 2, \"name\": \"Bob\"}]");

        CliTestSupport.Run run = CliTestSupport.run("validate", schema.toString(), "-c", config(), "--check-data");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ Player: 2 row(s) from players.json");
    }
}
