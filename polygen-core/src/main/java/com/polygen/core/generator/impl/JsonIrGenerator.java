package com.polygen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.AnnotationArgument;
import com.polygen.core.ast.Constraint;
import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.ConstraintText;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.ir.DataSourceSpec;
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
import com.polygen.core.ir.TypeRef;

/**
 * Dumps the resolved schema as JSON.
 *
 * <p>The document is assembled from sorted maps, so object keys are always written in
 * alphabetical order and two compilations of the same schema produce identical bytes.
 * Arrays keep declaration order.
 */
public class JsonIrGenerator implements SchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonIrGenerator.class);

    private static final String GENERATOR_ID = "json-ir";
    private static final String GENERATOR_DISPLAY_NAME = "JSON IR Generator";
    private static final String FILE_EXTENSION = "json";
    private static final String FORMAT_VERSION = "1";

    /** Setting that switches between indented (default) and single-line output */
    public static final String PRETTY_SETTING = "json-ir.pretty";

    private final ObjectMapper objectMapper;

    public JsonIrGenerator() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

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
        return Set.of(ArtifactType.IR_DUMP);
    }

    @Override
    public GeneratedArtifact generate(SchemaIr schema, ArtifactType type, GeneratorConfig config) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (type != ArtifactType.IR_DUMP) {
            throw new IllegalArgumentException("Unsupported artifact type: " + type);
        }

        Map<String, Object> root = object();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("namespaces", namespaces(schema, config));
        root.put("tables", schema.tables().values().stream()
            .filter(t -> config.includesNamespace(t.namespace())).map(this::table).toList());
        root.put("embeds", schema.embeds().values().stream()
            .filter(e -> config.includesNamespace(e.namespace())).map(this::embed).toList());
        root.put("enums", schema.enums().values().stream()
            .filter(e -> config.includesNamespace(e.namespace())).map(this::enumType).toList());
        root.put("relationships", schema.relationships().stream().map(this::relationship).toList());
        root.put("manyToMany", schema.manyToMany().stream().map(this::junction).toList());

        String content;
        try {
            ObjectWriter writer = config.flag(PRETTY_SETTING, true)
                ? objectMapper.writerWithDefaultPrettyPrinter()
                : objectMapper.writer();
            content = writer.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema IR", e);
        }

        log.info("Generated JSON IR: {} tables", schema.tables().size());
        return new GeneratedArtifact(type.artifactName(), content, getFileExtension());
    }

    private List<Object> namespaces(SchemaIr schema, GeneratorConfig config) {
        List<Object> namespaces = new ArrayList<>();
        for (NamespaceIr namespace : schema.namespaces()) {
            if (!config.includesNamespace(namespace.fqn())) {
                continue;
            }
            Map<String, Object> node = object();
            node.put("fqn", namespace.fqn());
            node.put("datasource", namespace.datasource());
            node.put("doc", namespace.doc());
            node.put("annotations", annotations(namespace.annotations()));
            node.put("declarations", namespace.declarations().stream()
                .map(d -> {
                    Map<String, Object> ref = object();
                    ref.put("kind", d.kind().keyword());
                    ref.put("fqn", d.fqn());
                    return ref;
                })
                .toList());
            namespaces.add(node);
        }
        return namespaces;
    }

    private Map<String, Object> table(TableIr table) {
        Map<String, Object> node = object();
        node.put("fqn", table.fqn());
        node.put("name", table.name());
        node.put("namespace", table.namespace());
        node.put("doc", table.doc());
        node.put("fields", fields(table.fields()));
        node.put("nestedEnums", table.nestedEnums());
        node.put("nestedEmbeds", table.nestedEmbeds());
        node.put("annotations", annotations(table.annotations()));
        node.put("options", options(table.options()));
        node.put("indexes", table.indexes().stream().map(this::index).toList());
        return node;
    }

    private Map<String, Object> embed(EmbedIr embed) {
        Map<String, Object> node = object();
        node.put("fqn", embed.fqn());
        node.put("name", embed.name());
        node.put("kind", embed.kind().name());
        node.put("namespace", embed.namespace());
        node.put("owner", embed.ownerFqn());
        node.put("doc", embed.doc());
        node.put("fields", fields(embed.fields()));
        node.put("nestedEnums", embed.nestedEnums());
        node.put("nestedEmbeds", embed.nestedEmbeds());
        node.put("annotations", annotations(embed.annotations()));
        return node;
    }

    private Map<String, Object> enumType(EnumIr enumIr) {
        Map<String, Object> node = object();
        node.put("fqn", enumIr.fqn());
        node.put("name", enumIr.name());
        node.put("namespace", enumIr.namespace());
        node.put("owner", enumIr.ownerFqn());
        node.put("inline", enumIr.inline());
        node.put("doc", enumIr.doc());
        node.put("annotations", annotations(enumIr.annotations()));
        List<Object> values = new ArrayList<>();
        for (EnumValueIr value : enumIr.values()) {
            Map<String, Object> valueNode = object();
            valueNode.put("name", value.name());
            valueNode.put("value", value.value());
            valueNode.put("doc", value.doc());
            values.add(valueNode);
        }
        node.put("values", values);
        return node;
    }

    private List<Object> fields(List<FieldIr> fields) {
        List<Object> nodes = new ArrayList<>();
        for (FieldIr field : fields) {
            Map<String, Object> node = object();
            node.put("name", field.name());
            node.put("type", type(field.type()));
            node.put("constraints", constraints(field.constraints()));
            node.put("annotations", annotations(field.annotations()));
            node.put("fieldNumber", field.fieldNumber());
            node.put("doc", field.doc());
            if (field.foreignKey() != null) {
                Map<String, Object> fk = object();
                fk.put("table", field.foreignKey().targetTable());
                fk.put("field", field.foreignKey().targetField());
                fk.put("relationName", field.foreignKey().relationName());
                node.put("foreignKey", fk);
            } else {
                node.put("foreignKey", null);
            }
            nodes.add(node);
        }
        return nodes;
    }

    private Map<String, Object> type(TypeRef type) {
        Map<String, Object> node = object();
        node.put("kind", type.kind().name());
        node.put("fqn", type.fqn());
        node.put("primitive", type.primitive() != null ? type.primitive().keyword() : null);
        node.put("modifier", type.modifier().name());
        node.put("embedKind", type.embedKind() != null ? type.embedKind().name() : null);
        return node;
    }

    private List<Object> constraints(List<Constraint> constraints) {
        List<Object> nodes = new ArrayList<>();
        for (Constraint constraint : constraints) {
            Map<String, Object> node = object();
            node.put("kind", constraint.kind().keyword());
            node.put("text", ConstraintText.format(constraint));
            nodes.add(node);
        }
        return nodes;
    }

    private List<Object> annotations(List<Annotation> annotations) {
        List<Object> nodes = new ArrayList<>();
        for (Annotation annotation : annotations) {
            Map<String, Object> node = object();
            node.put("name", annotation.name());
            List<Object> arguments = new ArrayList<>();
            for (AnnotationArgument argument : annotation.arguments()) {
                Map<String, Object> argumentNode = object();
                argumentNode.put("key", argument.key());
                argumentNode.put("kind", argument.value().kind().name());
                argumentNode.put("value", argument.value().text());
                arguments.add(argumentNode);
            }
            node.put("arguments", arguments);
            nodes.add(node);
        }
        return nodes;
    }

    private Map<String, Object> options(TableOptions options) {
        Map<String, Object> node = object();
        node.put("taggable", options.taggable());
        node.put("readonly", options.readonly());
        node.put("cache", options.cacheStrategy());
        node.put("softDelete", options.softDeleteField());
        node.put("renamedFrom", options.renamedFrom());
        node.put("datasource", options.datasource());
        node.put("output", options.output());
        node.put("load", dataSource(options.load()));
        node.put("save", dataSource(options.save()));
        if (options.linkRows() != null) {
            Map<String, Object> linkRows = object();
            linkRows.put("partitionBy", options.linkRows().partitionBy());
            linkRows.put("linkWith", options.linkRows().linkWith());
            node.put("linkRows", linkRows);
        } else {
            node.put("linkRows", null);
        }
        return node;
    }

    private Map<String, Object> dataSource(DataSourceSpec spec) {
        if (spec == null) {
            return null;
        }
        Map<String, Object> node = object();
        node.put("type", spec.type().schemaName());
        node.put("path", spec.path());
        node.put("params", new TreeMap<>(spec.params()));
        return node;
    }

    private Map<String, Object> index(IndexSpec index) {
        Map<String, Object> node = object();
        node.put("name", index.name());
        node.put("fields", index.fields());
        node.put("unique", index.unique());
        node.put("source", index.source().name());
        return node;
    }

    private Map<String, Object> relationship(RelationshipIr rel) {
        Map<String, Object> node = object();
        node.put("sourceTable", rel.sourceTable());
        node.put("sourceField", rel.sourceField());
        node.put("targetTable", rel.targetTable());
        node.put("targetField", rel.targetField());
        node.put("forward", rel.forward().symbol());
        node.put("reverseName", rel.reverseName());
        node.put("reverse", rel.reverse().symbol());
        node.put("explicitName", rel.explicitName());
        return node;
    }

    private Map<String, Object> junction(ManyToManyIr junction) {
        Map<String, Object> node = object();
        node.put("junctionTable", junction.junctionTable());
        node.put("leftTable", junction.leftTable());
        node.put("leftField", junction.leftField());
        node.put("rightTable", junction.rightTable());
        node.put("rightField", junction.rightField());
        return node;
    }

    private static Map<String, Object> object() {
        return new TreeMap<>();
    }
}
