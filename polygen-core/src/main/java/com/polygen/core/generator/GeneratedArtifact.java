package com.polygen.core.generator;

import java.util.Objects;

/**
 * Represents a generated artifact.
 *
 * @param name artifact name, used as the file base name
 * @param content artifact content (Markdown, JSON, etc.)
 * @param fileExtension file extension for this content
 */
public record GeneratedArtifact(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedArtifact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * File name of this artifact.
     *
     * @return {@code name.extension}
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
