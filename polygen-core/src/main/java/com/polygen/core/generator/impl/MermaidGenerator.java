package com.polygen.core.generator.impl;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.polygen.core.ast.Cardinality;
import com.polygen.core.ast.ConstraintKind;
import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.ir.EmbedIr;
import com.polygen.core.ir.EmbedKind;
import com.polygen.core.ir.EnumIr;
import com.polygen.core.ir.EnumValueIr;
import com.polygen.core.ir.FieldIr;
import com.polygen.core.ir.Multiplicity;
import com.polygen.core.ir.RelationshipIr;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.ir.TableIr;
import com.polygen.core.ir.TypeRef;
import com.polygen.core.ir.TypeRefKind;

/**
 * Generates Mermaid diagram definitions from a resolved schema.
 *
 * <p>This generator produces Mermaid.js diagram definitions embedded in Markdown files,
 * suitable for rendering in GitHub, GitLab and documentation sites.
 *
 * <h2>Supported Artifact Types</h2>
 * <ul>
 *   <li><b>Class Diagram:</b> tables, reusable and nested embeds and enums as classes;
 *       foreign keys as forward and reverse associations, embed fields as compositions</li>
 *   <li><b>ER Diagram:</b> tables as entities with PK/FK/UK markers and crow's-foot
 *       relationships derived from the inferred multiplicities</li>
 * </ul>
 *
 * <p>Inline embeds never become classes: they appear only as the type of the field
 * that declares them. Class identifiers are the sanitized FQN so that equally named
 * types in different namespaces stay distinct.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements SchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Mermaid diagram types
    private static final String CLASS_DIAGRAM = "classDiagram";
    private static final String ER_DIAGRAM = "erDiagram";

    // Sanitization patterns
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    // Class stereotypes
    private static final String TABLE_STEREOTYPE = "    <<table>>\n";
    private static final String EMBED_STEREOTYPE = "    <<embed>>\n";
    private static final String ENUM_STEREOTYPE = "    <<enumeration>>\n";

    // Placeholders for empty schemas
    private static final String NO_TYPES_CLASS = "  class Empty {\n    No tables found\n  }\n";
    private static final String NO_TABLES_ENTITY = "  PLACEHOLDER {\n    string note \"No tables found\"\n  }\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<ArtifactType> getSupportedArtifactTypes() {
        return Set.of(ArtifactType.CLASS_DIAGRAM, ArtifactType.ER_DIAGRAM);
    }

    @Override
    public GeneratedArtifact generate(SchemaIr schema, ArtifactType type, GeneratorConfig config) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedArtifactTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported artifact type: " + type);
        }

        log.debug("Generating Mermaid diagram for type: {}", type);

        String content = switch (type) {
            case CLASS_DIAGRAM -> generateClassDiagram(schema, config);
            case ER_DIAGRAM -> generateErDiagram(schema, config);
            default -> throw new IllegalArgumentException("Unsupported artifact type: " + type);
        };

        String artifactName = type.artifactName();
        log.info("Generated Mermaid diagram: {}", artifactName);

        return new GeneratedArtifact(artifactName, content, getFileExtension());
    }

    /**
     * Generates the class diagram.
     *
     * @param schema resolved schema
     * @param config generator configuration (theme, enum visibility, namespace filter)
     * @return Markdown-formatted Mermaid diagram
     */
    private String generateClassDiagram(SchemaIr schema, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Class Diagram", CLASS_DIAGRAM, config.theme());

        List<TableIr> tables = visibleTables(schema, config);
        List<EmbedIr> embeds = schema.embeds().values().stream()
            .filter(e -> e.kind() != EmbedKind.INLINE)
            .filter(e -> config.includesNamespace(e.namespace()))
            .toList();
        List<EnumIr> enums = config.includeEnums()
            ? schema.enums().values().stream()
                .filter(e -> !e.inline())
                .filter(e -> config.includesNamespace(e.namespace()))
                .toList()
            : List.of();

        if (tables.isEmpty() && embeds.isEmpty() && enums.isEmpty()) {
            sb.append(NO_TYPES_CLASS);
        } else {
            for (TableIr table : tables) {
                appendClass(sb, table.fqn(), table.name(), TABLE_STEREOTYPE, table.fields());
            }
            for (EmbedIr embed : embeds) {
                appendClass(sb, embed.fqn(), embed.name(), EMBED_STEREOTYPE, embed.fields());
            }
            for (EnumIr enumIr : enums) {
                appendEnumClass(sb, enumIr);
            }
            appendAssociations(sb, schema, tables);
            appendCompositions(sb, tables, embeds);
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    /**
     * Appends a class with one attribute line per field.
     */
    private void appendClass(StringBuilder sb, String fqn, String name, String stereotype, List<FieldIr> fields) {
        sb.append("  class ").append(sanitizeId(fqn)).append("[\"").append(escape(name)).append("\"] {\n");
        sb.append(stereotype);
        for (FieldIr field : fields) {
            sb.append("    +").append(formatClassType(field.type())).append(" ").append(field.name());
            if (field.isPrimaryKey()) {
                sb.append(" PK");
            }
            sb.append(MARKDOWN_NEWLINE);
        }
        sb.append("  }\n");
    }

    private void appendEnumClass(StringBuilder sb, EnumIr enumIr) {
        sb.append("  class ").append(sanitizeId(enumIr.fqn())).append("[\"").append(escape(enumIr.name())).append("\"] {\n");
        sb.append(ENUM_STEREOTYPE);
        for (EnumValueIr value : enumIr.values()) {
            sb.append("    ").append(value.name()).append(MARKDOWN_NEWLINE);
        }
        sb.append("  }\n");
    }

    /**
     * Appends one forward and one reverse association per foreign key.
     *
     * <p>Forward: {@code Source "1" --> "1" Target : field}. Reverse:
     * {@code Target "1" -- "*" Source : reverseName}.
     */
    private void appendAssociations(StringBuilder sb, SchemaIr schema, List<TableIr> tables) {
        Set<String> visible = tables.stream().map(TableIr::fqn).collect(Collectors.toSet());
        for (RelationshipIr rel : schema.relationships()) {
            if (!visible.contains(rel.sourceTable()) || !visible.contains(rel.targetTable())) {
                continue;
            }
            String source = sanitizeId(rel.sourceTable());
            String target = sanitizeId(rel.targetTable());
            sb.append("  ").append(source).append(" \"").append(rel.forward().symbol()).append("\" --> \"1\" ")
                .append(target).append(" : ").append(rel.sourceField()).append(MARKDOWN_NEWLINE);
            sb.append("  ").append(target).append(" \"1\" -- \"").append(rel.reverse().symbol()).append("\" ")
                .append(source).append(" : ").append(rel.reverseName()).append(MARKDOWN_NEWLINE);
        }
    }

    /**
     * Appends composition edges from owners to the reusable or nested embeds their fields use.
     */
    private void appendCompositions(StringBuilder sb, List<TableIr> tables, List<EmbedIr> embeds) {
        Set<String> visibleEmbeds = embeds.stream().map(EmbedIr::fqn).collect(Collectors.toSet());
        for (TableIr table : tables) {
            appendCompositionEdges(sb, table.fqn(), table.fields(), visibleEmbeds);
        }
        for (EmbedIr embed : embeds) {
            appendCompositionEdges(sb, embed.fqn(), embed.fields(), visibleEmbeds);
        }
    }

    private void appendCompositionEdges(StringBuilder sb, String ownerFqn, List<FieldIr> fields, Set<String> visibleEmbeds) {
        for (FieldIr field : fields) {
            TypeRef type = field.type();
            if (type.kind() != TypeRefKind.EMBED || !visibleEmbeds.contains(type.fqn())) {
                continue;
            }
            sb.append("  ").append(sanitizeId(ownerFqn)).append(" *-- \"")
                .append(Multiplicity.fromCardinality(type.modifier()).symbol()).append("\" ")
                .append(sanitizeId(type.fqn())).append(" : ").append(field.name()).append(MARKDOWN_NEWLINE);
        }
    }

    /**
     * Generates the entity-relationship diagram.
     *
     * @param schema resolved schema
     * @param config generator configuration (theme, namespace filter)
     * @return Markdown-formatted Mermaid diagram
     */
    private String generateErDiagram(SchemaIr schema, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Entity-Relationship Diagram", ER_DIAGRAM, config.theme());

        List<TableIr> tables = visibleTables(schema, config);
        if (tables.isEmpty()) {
            sb.append(NO_TABLES_ENTITY);
        } else {
            for (TableIr table : tables) {
                appendEntity(sb, table);
            }
            appendErRelationships(sb, schema, tables);
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private void appendEntity(StringBuilder sb, TableIr table) {
        sb.append("  ").append(sanitizeId(table.fqn())).append(" {\n");
        if (table.fields().isEmpty()) {
            sb.append("    string placeholder \"No fields defined\"\n");
        }
        for (FieldIr field : table.fields()) {
            sb.append("    ").append(formatErType(field.type())).append(" ").append(field.name());
            String keys = keyMarkers(field);
            if (!keys.isEmpty()) {
                sb.append(" ").append(keys);
            }
            if (field.doc() != null) {
                sb.append(" \"").append(escape(field.doc())).append("\"");
            }
            sb.append(MARKDOWN_NEWLINE);
        }
        sb.append("  }\n");
    }

    private String keyMarkers(FieldIr field) {
        StringBuilder markers = new StringBuilder();
        if (field.isPrimaryKey()) {
            markers.append("PK");
        }
        if (field.foreignKey() != null) {
            markers.append(markers.length() > 0 ? ", " : "").append("FK");
        }
        if (field.hasConstraint(ConstraintKind.UNIQUE)) {
            markers.append(markers.length() > 0 ? ", " : "").append("UK");
        }
        return markers.toString();
    }

    /**
     * Appends crow's-foot relationships: {@code TARGET ||--o{ SOURCE : "reverseName"}.
     */
    private void appendErRelationships(StringBuilder sb, SchemaIr schema, List<TableIr> tables) {
        Set<String> visible = tables.stream().map(TableIr::fqn).collect(Collectors.toSet());
        for (RelationshipIr rel : schema.relationships()) {
            if (!visible.contains(rel.sourceTable()) || !visible.contains(rel.targetTable())) {
                continue;
            }
            String targetSide = rel.forward() == Multiplicity.ZERO_OR_ONE ? "|o" : "||";
            String sourceSide = rel.reverse() == Multiplicity.ONE ? "o|" : "o{";
            sb.append("  ").append(sanitizeId(rel.targetTable())).append(" ").append(targetSide).append("--")
                .append(sourceSide).append(" ").append(sanitizeId(rel.sourceTable()))
                .append(" : \"").append(escape(rel.reverseName())).append("\"\n");
        }
    }

    private List<TableIr> visibleTables(SchemaIr schema, GeneratorConfig config) {
        return schema.tables().values().stream()
            .filter(t -> config.includesNamespace(t.namespace()))
            .toList();
    }

    /**
     * Appends diagram header with title, optional theme directive and Mermaid code block.
     *
     * @param sb the string builder
     * @param title the diagram title
     * @param diagramType the Mermaid diagram type keyword
     * @param theme optional Mermaid theme
     */
    private void appendDiagramHeader(StringBuilder sb, String title, String diagramType, String theme) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        if (theme != null && !theme.isEmpty()) {
            sb.append("%%{init: {'theme': '").append(escape(theme)).append("'}}%%").append(MARKDOWN_NEWLINE);
        }
        sb.append(diagramType).append(MARKDOWN_NEWLINE);
    }

    /**
     * Appends diagram footer (closing code block).
     *
     * @param sb the string builder
     */
    private void appendDiagramFooter(StringBuilder sb) {
        sb.append(CODE_BLOCK_END);
    }

    /** Class attribute type: {@code T}, {@code T?} or {@code List~T~}. */
    private String formatClassType(TypeRef type) {
        String base = type.baseName();
        if (type.modifier() == Cardinality.ARRAY) {
            return "List~" + base + "~";
        }
        return type.modifier() == Cardinality.OPTIONAL ? base + "?" : base;
    }

    /** ER attribute types only allow word characters and brackets. */
    private String formatErType(TypeRef type) {
        String base = type.baseName();
        return type.modifier() == Cardinality.ARRAY ? base + "[]" : base;
    }

    /**
     * Sanitizes identifiers for use as Mermaid node IDs.
     *
     * <p>Mermaid node IDs must be alphanumeric with underscores. This method replaces
     * the dots of a qualified name and any other special character.
     *
     * @param id the identifier to sanitize (may be null)
     * @return sanitized identifier, or "unknown" if input is null
     */
    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes special characters in text for safe embedding in Mermaid diagrams.
     *
     * @param text the text to escape (may be null)
     * @return escaped text, or empty string if input is null
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
