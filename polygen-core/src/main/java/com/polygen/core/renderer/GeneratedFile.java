package com.polygen.core.renderer;

import com.polygen.core.generator.GeneratedArtifact;

import java.util.Objects;

/**
 * A file ready to be rendered.
 *
 * @param relativePath path relative to the output directory
 * @param content file content
 * @param contentType MIME type, or null if unknown
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Places an artifact under a directory named after its generator.
     *
     * @param generatorId id of the generator that produced the artifact
     * @param artifact generated artifact
     * @return file at {@code generatorId/name.extension}
     */
    public static GeneratedFile of(String generatorId, GeneratedArtifact artifact) {
        return new GeneratedFile(generatorId + "/" + artifact.fileName(), artifact.content(),
            contentTypeFor(artifact.fileExtension()));
    }

    private static String contentTypeFor(String extension) {
        return switch (extension) {
            case "md" -> "text/markdown";
            case "json" -> "application/json";
            default -> "text/plain";
        };
    }
}
