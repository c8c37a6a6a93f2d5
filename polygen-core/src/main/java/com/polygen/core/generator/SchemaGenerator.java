package com.polygen.core.generator;

import com.polygen.core.ir.SchemaIr;

import java.util.Set;

/**
 * Interface for backends that turn a resolved schema into text artifacts.
 *
 * <p>Generators consume the immutable {@link SchemaIr} and never modify it, so one IR
 * instance can be shared by generators running in parallel. Each generator supports
 * one or more {@link ArtifactType}s.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and can be
 * enabled/disabled via configuration.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidGenerator implements SchemaGenerator {
 *     @Override
 *     public String getId() {
 *         return "mermaid";
 *     }
 *
 *     @Override
 *     public Set<ArtifactType> getSupportedArtifactTypes() {
 *         return Set.of(ArtifactType.CLASS_DIAGRAM, ArtifactType.ER_DIAGRAM);
 *     }
 *
 *     @Override
 *     public GeneratedArtifact generate(SchemaIr schema, ArtifactType type, GeneratorConfig config) {
 *         String content = switch (type) {
 *             case CLASS_DIAGRAM -> generateClassDiagram(schema);
 *             case ER_DIAGRAM -> generateErDiagram(schema);
 *             default -> throw new IllegalArgumentException("Unsupported artifact type: " + type);
 *         };
 *         return new GeneratedArtifact(type.artifactName(), content, "md");
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.polygen.core.generator.SchemaGenerator}
 *
 * @see SchemaIr
 * @see ArtifactType
 * @see GeneratorConfig
 * @see GeneratedArtifact
 */
public interface SchemaGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration and on the command line.
     * Should be lowercase (e.g., "mermaid", "json-ir").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated artifacts.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of artifact types this generator can produce.
     *
     * <p>The framework calls {@link #generate(SchemaIr, ArtifactType, GeneratorConfig)}
     * once per supported type.
     *
     * @return supported artifact types
     */
    Set<ArtifactType> getSupportedArtifactTypes();

    /**
     * Generates an artifact from the resolved schema.
     *
     * <p>If the schema holds nothing for the requested type, generate a meaningful
     * placeholder (e.g., "No tables found").
     *
     * @param schema the resolved schema, read-only
     * @param type the artifact type to generate
     * @param config configuration settings for generation
     * @return generated artifact content
     * @throws IllegalArgumentException if the artifact type is not supported
     */
    GeneratedArtifact generate(SchemaIr schema, ArtifactType type, GeneratorConfig config);
}
