package com.polygen.core.generator;

/**
 * Types of artifacts that generators can produce.
 */
public enum ArtifactType {
    /** Class diagram of tables, embeds and enums with relationship edges */
    CLASS_DIAGRAM,

    /** Entity-relationship diagram of tables and foreign keys */
    ER_DIAGRAM,

    /** Machine-readable dump of the resolved schema */
    IR_DUMP,

    /** Human-readable data dictionary */
    SCHEMA_REFERENCE;

    /**
     * Artifact name used for file names: lower case with dashes.
     *
     * @return artifact name, e.g. {@code class-diagram}
     */
    public String artifactName() {
        return name().toLowerCase().replace('_', '-');
    }
}
