package com.polygen.core.renderer.impl;

import com.polygen.core.renderer.GeneratedFile;
import com.polygen.core.renderer.GeneratedOutput;
import com.polygen.core.renderer.OutputRenderer;
import com.polygen.core.renderer.RenderContext;
import com.polygen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes generated files to the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Files whose content differs are overwritten; identical files are left untouched so
 * their timestamps stay stable for incremental builds.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code filesystem.clean} - delete the contents of the output directory before
 *       writing ("true"/"false", default: "false")</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./generated", Map.of("filesystem.clean", "true"));
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("mermaid/class-diagram.md", "# Class Diagram...", "text/markdown")
 * ));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./generated/mermaid/class-diagram.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String CLEAN_SETTING = "filesystem.clean";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        boolean clean = context.flag(CLEAN_SETTING, false);
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            if (clean && Files.isDirectory(outputDir)) {
                logger.info("Cleaning output directory: {}", outputDir);
                FileUtils.deleteContents(outputDir);
            }
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to prepare output directory: " + outputDir, e);
        }

        int unchanged = 0;
        for (GeneratedFile file : output.files()) {
            if (!writeFile(outputDir, file)) {
                unchanged++;
            }
        }

        logger.info("Successfully rendered {} files to filesystem ({} unchanged)", output.files().size(), unchanged);
    }

    /**
     * Writes a single file unless it already holds the same content.
     *
     * @param outputDir base output directory
     * @param file file to write
     * @return false if the file was left untouched
     */
    private boolean writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File path escapes the output directory: " + file.relativePath());
        }

        try {
            if (Files.isRegularFile(targetPath) && Files.readString(targetPath, StandardCharsets.UTF_8).equals(file.content())) {
                logger.debug("Unchanged: {}", targetPath);
                return false;
            }
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
