package com.polygen.core.generator.impl;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.ConstraintText;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.ir.DataSourceSpec;
import com.polygen.core.ir.DeclarationRef;
import com.polygen.core.ir.EmbedIr;
import com.polygen.core.ir.EnumIr;
import com.polygen.core.ir.EnumValueIr;
import com.polygen.core.ir.FieldIr;
import com.polygen.core.ir.IndexSpec;
import com.polygen.core.ir.ManyToManyIr;
import com.polygen.core.ir.NamespaceIr;
import com.polygen.core.ir.RelationshipIr;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.ir.TableIr;
import com.polygen.core.ir.TableOptions;

/**
 * Generates a Markdown data dictionary from a resolved schema.
 *
 * <p>One section per namespace, in first-appearance order, lists its tables, embeds and
 * enums in declaration order. Tables get a field table, their interpreted options,
 * indexes and incoming and outgoing relationships.
 *
 * <h2>Documentation Structure</h2>
 * <pre>
 * # Schema Reference
 * ## Summary                 counts
 * ## Namespace game          one per namespace
 * ### Table Player           fields, options, indexes, relationships
 * ### Embed Position         fields
 * ### Enum Status            values
 * ## Many-to-Many Relations  junction tables
 * </pre>
 */
public class MarkdownGenerator implements SchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownGenerator.class);

    private static final String GENERATOR_ID = "markdown";
    private static final String GENERATOR_DISPLAY_NAME = "Markdown Reference Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String PIPE = "|";
    private static final String SPACE = " ";
    private static final String DIVIDER = " --- |";
    private static final String DASH_VALUE = "-";
    private static final String BULLET = "- ";
    private static final String CODE = "`";

    // Titles
    private static final String DOCUMENT_TITLE = "Schema Reference";

    /** Setting that overrides the document title */
    public static final String TITLE_SETTING = "markdown.title";
    private static final String SUMMARY = "Summary";
    private static final String ROOT_NAMESPACE = "(root)";
    private static final String MANY_TO_MANY = "Many-to-Many Relations";

    // Column headers
    private static final String FIELD = "Field";
    private static final String TYPE = "Type";
    private static final String CONSTRAINTS = "Constraints";
    private static final String DESCRIPTION = "Description";
    private static final String NAME = "Name";
    private static final String VALUE = "Value";
    private static final String METRIC = "Metric";
    private static final String COUNT = "Count";

    private static final String NO_TABLES_MESSAGE = "No tables found.";

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
        return Set.of(ArtifactType.SCHEMA_REFERENCE);
    }

    @Override
    public GeneratedArtifact generate(SchemaIr schema, ArtifactType type, GeneratorConfig config) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (type != ArtifactType.SCHEMA_REFERENCE) {
            throw new IllegalArgumentException("Unsupported artifact type: " + type);
        }

        StringBuilder sb = new StringBuilder();
        appendHeader(sb, 1, config.setting(TITLE_SETTING, DOCUMENT_TITLE));
        appendSummary(sb, schema);

        if (schema.tables().isEmpty()) {
            sb.append(NO_TABLES_MESSAGE).append(DOUBLE_NEWLINE);
        }
        for (NamespaceIr namespace : schema.namespaces()) {
            if (config.includesNamespace(namespace.fqn())) {
                appendNamespace(sb, schema, namespace);
            }
        }
        appendManyToMany(sb, schema.manyToMany());

        log.info("Generated Markdown reference for {} namespaces", schema.namespaces().size());
        return new GeneratedArtifact(type.artifactName(), sb.toString(), getFileExtension());
    }

    private void appendSummary(StringBuilder sb, SchemaIr schema) {
        appendHeader(sb, 2, SUMMARY);
        appendTableRow(sb, METRIC, COUNT);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Namespaces", String.valueOf(schema.namespaces().size()));
        appendTableRow(sb, "Tables", String.valueOf(schema.tables().size()));
        appendTableRow(sb, "Embeds", String.valueOf(schema.embeds().size()));
        appendTableRow(sb, "Enums", String.valueOf(schema.enums().size()));
        appendTableRow(sb, "Relationships", String.valueOf(schema.relationships().size()));
        sb.append(NEWLINE);
    }

    private void appendNamespace(StringBuilder sb, SchemaIr schema, NamespaceIr namespace) {
        appendHeader(sb, 2, "Namespace " + (namespace.fqn().isEmpty() ? ROOT_NAMESPACE : namespace.fqn()));
        if (namespace.doc() != null) {
            sb.append(namespace.doc()).append(DOUBLE_NEWLINE);
        }
        if (namespace.datasource() != null) {
            sb.append("Datasource: ").append(CODE).append(namespace.datasource()).append(CODE).append(DOUBLE_NEWLINE);
        }

        for (DeclarationRef declaration : namespace.declarations()) {
            switch (declaration.kind()) {
                case TABLE -> schema.table(declaration.fqn()).ifPresent(t -> appendTable(sb, schema, t));
                case EMBED -> schema.embed(declaration.fqn()).ifPresent(e -> appendEmbed(sb, schema, e));
                case ENUM -> schema.enumType(declaration.fqn()).ifPresent(e -> appendEnum(sb, e));
                case NAMESPACE -> {
                    // namespaces get their own section
                }
            }
        }
    }

    private void appendTable(StringBuilder sb, SchemaIr schema, TableIr table) {
        appendHeader(sb, 3, "Table " + table.name());
        if (table.doc() != null) {
            sb.append(table.doc()).append(DOUBLE_NEWLINE);
        }
        appendFields(sb, table.fields());
        appendOptions(sb, table.options());
        appendIndexes(sb, table.indexes());
        appendRelationships(sb, schema, table);
        appendNestedTypes(sb, schema, table.nestedEmbeds(), table.nestedEnums());
    }

    private void appendEmbed(StringBuilder sb, SchemaIr schema, EmbedIr embed) {
        appendHeader(sb, 3, "Embed " + embed.name());
        if (embed.doc() != null) {
            sb.append(embed.doc()).append(DOUBLE_NEWLINE);
        }
        appendFields(sb, embed.fields());
        appendNestedTypes(sb, schema, embed.nestedEmbeds(), embed.nestedEnums());
    }

    private void appendEnum(StringBuilder sb, EnumIr enumIr) {
        appendHeader(sb, enumIr.ownerFqn() == null ? 3 : 4, "Enum " + enumIr.name());
        if (enumIr.doc() != null) {
            sb.append(enumIr.doc()).append(DOUBLE_NEWLINE);
        }
        appendTableRow(sb, NAME, VALUE, DESCRIPTION);
        appendTableDivider(sb, 3);
        for (EnumValueIr value : enumIr.values()) {
            appendTableRow(sb, value.name(), String.valueOf(value.value()), escapeMarkdown(nullSafeValue(value.doc(), DASH_VALUE)));
        }
        sb.append(NEWLINE);
    }

    private void appendFields(StringBuilder sb, List<FieldIr> fields) {
        if (fields.isEmpty()) {
            sb.append("No fields defined.").append(DOUBLE_NEWLINE);
            return;
        }
        appendTableRow(sb, FIELD, TYPE, CONSTRAINTS, DESCRIPTION);
        appendTableDivider(sb, 4);
        for (FieldIr field : fields) {
            String constraints = ConstraintText.formatAll(field.constraints());
            appendTableRow(sb,
                CODE + field.name() + CODE,
                CODE + escapeMarkdown(field.type().toString()) + CODE,
                constraints.isEmpty() ? DASH_VALUE : escapeMarkdown(constraints),
                escapeMarkdown(nullSafeValue(field.doc(), DASH_VALUE))
            );
        }
        sb.append(NEWLINE);
    }

    private void appendOptions(StringBuilder sb, TableOptions options) {
        StringBuilder lines = new StringBuilder();
        if (options.taggable()) {
            lines.append(BULLET).append("Taggable").append(NEWLINE);
        }
        if (options.readonly()) {
            lines.append(BULLET).append("Read-only").append(NEWLINE);
        }
        if (options.linkRows() != null) {
            lines.append(BULLET).append("Linked rows: partitioned by ").append(CODE).append(options.linkRows().partitionBy())
                .append(CODE).append(", linked with ").append(CODE).append(options.linkRows().linkWith()).append(CODE).append(NEWLINE);
        }
        appendDataSource(lines, "Load", options.load());
        appendDataSource(lines, "Save", options.save());
        appendOption(lines, "Cache", options.cacheStrategy());
        appendOption(lines, "Soft delete", options.softDeleteField());
        appendOption(lines, "Renamed from", options.renamedFrom());
        appendOption(lines, "Datasource", options.datasource());
        appendOption(lines, "Output", options.output());
        if (lines.length() > 0) {
            sb.append("**Options:**").append(DOUBLE_NEWLINE).append(lines).append(NEWLINE);
        }
    }

    private void appendDataSource(StringBuilder lines, String label, DataSourceSpec spec) {
        if (spec == null) {
            return;
        }
        lines.append(BULLET).append(label).append(": ").append(spec.type().schemaName());
        if (spec.path() != null) {
            lines.append(" from ").append(CODE).append(spec.path()).append(CODE);
        }
        lines.append(NEWLINE);
    }

    private void appendOption(StringBuilder lines, String label, String value) {
        if (value != null) {
            lines.append(BULLET).append(label).append(": ").append(CODE).append(value).append(CODE).append(NEWLINE);
        }
    }

    private void appendIndexes(StringBuilder sb, List<IndexSpec> indexes) {
        if (indexes.isEmpty()) {
            return;
        }
        sb.append("**Indexes:**").append(DOUBLE_NEWLINE);
        appendTableRow(sb, NAME, "Fields", "Unique");
        appendTableDivider(sb, 3);
        for (IndexSpec index : indexes) {
            appendTableRow(sb, index.name(), String.join(", ", index.fields()), index.unique() ? "Yes" : "No");
        }
        sb.append(NEWLINE);
    }

    private void appendRelationships(StringBuilder sb, SchemaIr schema, TableIr table) {
        List<RelationshipIr> outgoing = schema.relationshipsFrom(table.fqn());
        List<RelationshipIr> incoming = schema.relationshipsTo(table.fqn());
        if (outgoing.isEmpty() && incoming.isEmpty()) {
            return;
        }
        sb.append("**Relationships:**").append(DOUBLE_NEWLINE);
        for (RelationshipIr rel : outgoing) {
            sb.append(BULLET).append(CODE).append(rel.sourceField()).append(CODE).append(" references ")
                .append(CODE).append(rel.targetTable()).append(".").append(rel.targetField()).append(CODE)
                .append(" (").append(rel.forward().symbol()).append(")").append(NEWLINE);
        }
        for (RelationshipIr rel : incoming) {
            sb.append(BULLET).append(CODE).append(rel.reverseName()).append(CODE).append(": ")
                .append(rel.reverse().symbol()).append(SPACE).append(CODE).append(rel.sourceTable()).append(CODE)
                .append(" via ").append(CODE).append(rel.sourceField()).append(CODE).append(NEWLINE);
        }
        sb.append(NEWLINE);
    }

    private void appendNestedTypes(StringBuilder sb, SchemaIr schema, List<String> embeds, List<String> enums) {
        for (String fqn : embeds) {
            schema.embed(fqn).ifPresent(embed -> {
                appendHeader(sb, 4, "Embed " + embed.name() + " (" + embed.kind().name().toLowerCase().replace('_', ' ') + ")");
                appendFields(sb, embed.fields());
            });
        }
        for (String fqn : enums) {
            schema.enumType(fqn).ifPresent(e -> appendEnum(sb, e));
        }
    }

    private void appendManyToMany(StringBuilder sb, List<ManyToManyIr> junctions) {
        if (junctions.isEmpty()) {
            return;
        }
        appendHeader(sb, 2, MANY_TO_MANY);
        appendTableRow(sb, "Junction", "Left", "Right");
        appendTableDivider(sb, 3);
        for (ManyToManyIr junction : junctions) {
            appendTableRow(sb, junction.junctionTable(),
                junction.leftTable() + " (" + junction.leftField() + ")",
                junction.rightTable() + " (" + junction.rightField() + ")");
        }
        sb.append(NEWLINE);
    }

    private void appendHeader(StringBuilder sb, int level, String title) {
        sb.append("#".repeat(level)).append(SPACE).append(title).append(DOUBLE_NEWLINE);
    }

    private String nullSafeValue(String value, String defaultValue) {
        return value != null ? value : defaultValue;
    }

    /**
     * Escapes markdown special characters.
     */
    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(col).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        sb.append(DIVIDER.repeat(columnCount));
        sb.append(NEWLINE);
    }
}
