package com.polygen.core.renderer.impl;

import com.polygen.core.renderer.GeneratedFile;
import com.polygen.core.renderer.GeneratedOutput;
import com.polygen.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesFilesUnderGeneratorDirectories() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("mermaid/class-diagram.md", "# Class Diagram\n", "text/markdown"),
            new GeneratedFile("json-ir/ir-dump.json", "{}\n", "application/json")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("mermaid/class-diagram.md"))).isEqualTo("# Class Diagram\n");
        assertThat(Files.readString(tempDir.resolve("json-ir/ir-dump.json"))).isEqualTo("{}\n");
    }

    @Test
    void render_withClean_removesStaleFiles() throws IOException {
        Path stale = tempDir.resolve("old/stale.md");
        Files.createDirectories(stale.getParent());
        Files.writeString(stale, "stale");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("new.md", "fresh", null)));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of(FileSystemRenderer.CLEAN_SETTING, "true")));

        assertThat(stale).doesNotExist();
        assertThat(tempDir.resolve("old")).doesNotExist();
        assertThat(tempDir.resolve("new.md")).hasContent("fresh");
    }

    @Test
    void render_withoutClean_keepsExistingFiles() throws IOException {
        Path existing = tempDir.resolve("keep.md");
        Files.writeString(existing, "keep");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("new.md", "fresh", null))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(existing).hasContent("keep");
    }

    @Test
    void render_withEscapingPath_throwsException() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../outside.md", "x", null)));

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(tempDir.resolve("out").toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes the output directory");
    }

    @Test
    void render_withIdenticalContent_leavesFileUntouched() throws IOException {
        Path target = tempDir.resolve("markdown/schema-reference.md");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "same");
        FileTime before = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(target, before);

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("markdown/schema-reference.md", "same", null))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.getLastModifiedTime(target)).isEqualTo(before);
    }

    @Test
    void render_withChangedContent_overwritesFile() throws IOException {
        Path target = tempDir.resolve("a.md");
        Files.writeString(target, "old");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("a.md", "new", null))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(target).hasContent("new");
    }
}
