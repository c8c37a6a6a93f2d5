package com.polygen.core.ir;

import com.polygen.core.ast.Definition;
import com.polygen.core.ast.DefinitionKind;
import com.polygen.core.ast.EmbedDef;
import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.EnumVariant;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.TableDef;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.imports.MergedNamespace;
import com.polygen.core.imports.MergedSchema;
import com.polygen.core.util.NamingUtils;
import com.polygen.core.validation.SymbolTable;
import com.polygen.core.validation.TypeSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the immutable {@link SchemaIr} from a validated merged schema.
 *
 * <p>Every field type is resolved to a {@link TypeRef}, every embed is classified,
 * annotations are interpreted and the relationship graph is inferred. The builder
 * assumes validation passed: an unresolved reference is an {@link IllegalStateException}.
 */
public class IrBuilder {

    private static final Logger log = LoggerFactory.getLogger(IrBuilder.class);

    private final EmbedClassifier embedClassifier;
    private final AnnotationInterpreter annotationInterpreter;
    private final RelationshipInferrer relationshipInferrer;

    public IrBuilder() {
        this(new EmbedClassifier(), new AnnotationInterpreter(), new RelationshipInferrer());
    }

    public IrBuilder(EmbedClassifier embedClassifier, AnnotationInterpreter annotationInterpreter,
                     RelationshipInferrer relationshipInferrer) {
        this.embedClassifier = Objects.requireNonNull(embedClassifier, "embedClassifier must not be null");
        this.annotationInterpreter = Objects.requireNonNull(annotationInterpreter, "annotationInterpreter must not be null");
        this.relationshipInferrer = Objects.requireNonNull(relationshipInferrer, "relationshipInferrer must not be null");
    }

    /**
     * Builds the IR.
     *
     * @param merged validated merged schema
     * @return schema IR
     * @throws IllegalStateException if a type or foreign-key reference does not resolve
     */
    public SchemaIr build(MergedSchema merged) {
        Objects.requireNonNull(merged, "merged must not be null");
        SymbolTable symbols = SymbolTable.build(merged);
        Map<String, EmbedKind> embedKinds = embedClassifier.classify(symbols);

        Map<String, String> namespaceDatasources = new LinkedHashMap<>();
        for (MergedNamespace namespace : merged.namespaces()) {
            namespaceDatasources.put(namespace.fqn(), annotationInterpreter.datasource(namespace.annotations()));
        }

        Map<String, TableIr> tables = new LinkedHashMap<>();
        Map<String, EnumIr> enums = new LinkedHashMap<>();
        Map<String, EmbedIr> embeds = new LinkedHashMap<>();

        for (TypeSite site : symbols.sites()) {
            Definition definition = site.definition();
            if (definition instanceof TableDef table) {
                String inherited = inheritedDatasource(site.namespaceFqn(), namespaceDatasources);
                tables.putIfAbsent(site.fqn(), buildTable(site, table, symbols, embedKinds, inherited));
            } else if (definition instanceof EmbedDef embed) {
                embeds.putIfAbsent(site.fqn(), buildEmbed(site, embed, symbols, embedKinds));
            } else if (definition instanceof EnumDef enumDef) {
                enums.putIfAbsent(site.fqn(), buildEnum(site, enumDef));
            }
        }

        List<NamespaceIr> namespaces = new ArrayList<>();
        for (MergedNamespace namespace : merged.namespaces()) {
            if (namespace.isRoot() && namespace.types().isEmpty()) {
                continue;
            }
            List<DeclarationRef> declarations = namespace.types().stream()
                .map(d -> new DeclarationRef(d.definitionKind(), NamingUtils.qualify(namespace.fqn(), d.name())))
                .toList();
            namespaces.add(new NamespaceIr(namespace.fqn(), namespaceDatasources.get(namespace.fqn()),
                namespace.annotations(), declarations, namespace.doc()));
        }

        List<RelationshipIr> relationships = relationshipInferrer.relationships(tables.values());
        List<ManyToManyIr> junctions = relationshipInferrer.junctions(tables.values());

        log.info("Built IR: {} tables, {} enums, {} embeds, {} relationships",
            tables.size(), enums.size(), embeds.size(), relationships.size());
        return new SchemaIr(namespaces, tables, enums, embeds, relationships, junctions);
    }

    private TableIr buildTable(TypeSite site, TableDef table, SymbolTable symbols,
                               Map<String, EmbedKind> embedKinds, String inheritedDatasource) {
        log.debug("Building table {}", site.fqn());
        List<FieldIr> fields = buildFields(site, table, symbols, embedKinds);
        return new TableIr(
            site.fqn(),
            table.name(),
            site.namespaceFqn(),
            fields,
            nested(site, table, DefinitionKind.ENUM),
            nested(site, table, DefinitionKind.EMBED),
            table.annotations(),
            annotationInterpreter.tableOptions(table.annotations(), inheritedDatasource),
            annotationInterpreter.indexes(table.name(), fields, table.annotations()),
            table.doc(),
            table.location());
    }

    private EmbedIr buildEmbed(TypeSite site, EmbedDef embed, SymbolTable symbols, Map<String, EmbedKind> embedKinds) {
        return new EmbedIr(
            site.fqn(),
            embed.name(),
            embedKinds.get(site.fqn()),
            site.namespaceFqn(),
            site.ownerFqn(),
            buildFields(site, embed, symbols, embedKinds),
            nested(site, embed, DefinitionKind.ENUM),
            nested(site, embed, DefinitionKind.EMBED),
            embed.annotations(),
            embed.doc());
    }

    private EnumIr buildEnum(TypeSite site, EnumDef enumDef) {
        List<EnumValueIr> values = new ArrayList<>();
        long next = 0;
        for (EnumVariant variant : enumDef.variants()) {
            long value = variant.value() != null ? variant.value() : next;
            values.add(new EnumValueIr(variant.name(), value, variant.doc()));
            next = value + 1;
        }
        return new EnumIr(site.fqn(), enumDef.name(), site.namespaceFqn(), site.ownerFqn(),
            site.siteKind() == TypeSite.SiteKind.INLINE, values, enumDef.annotations(), enumDef.doc());
    }

    private List<FieldIr> buildFields(TypeSite owner, FieldContainer container, SymbolTable symbols,
                                      Map<String, EmbedKind> embedKinds) {
        List<FieldIr> fields = new ArrayList<>();
        for (FieldDef field : container.fields()) {
            TypeRef type = resolveType(owner, field, symbols, embedKinds);
            ForeignKeyRef foreignKey = field.foreignKey()
                .map(fk -> {
                    TypeSite target = symbols.resolveForeignKeyTarget(fk.targetTable(), owner)
                        .filter(TypeSite::isTable)
                        .orElseThrow(() -> new IllegalStateException(
                            "Unresolved foreign key target '" + fk.targetTable() + "' on " + owner.fqn() + "." + field.name()));
                    return new ForeignKeyRef(target.fqn(), fk.targetField(), fk.relationName());
                })
                .orElse(null);
            fields.add(new FieldIr(field.name(), type, field.constraints(), field.annotations(), foreignKey,
                field.fieldNumber(), field.doc()));
        }
        return fields;
    }

    private TypeRef resolveType(TypeSite owner, FieldDef field, SymbolTable symbols, Map<String, EmbedKind> embedKinds) {
        if (field.type() instanceof TypeExpr.Primitive primitive) {
            return TypeRef.primitive(primitive.type(), field.cardinality());
        }
        TypeSite target = symbols.resolveFieldType(field, owner)
            .orElseThrow(() -> new IllegalStateException(
                "Unresolved type '" + field.type().displayName() + "' on " + owner.fqn() + "." + field.name()));
        if (target.isEnum()) {
            return TypeRef.enumType(target.fqn(), field.cardinality());
        }
        if (target.isEmbed()) {
            return TypeRef.embed(target.fqn(), embedKinds.get(target.fqn()), field.cardinality());
        }
        return TypeRef.table(target.fqn(), field.cardinality());
    }

    private static List<String> nested(TypeSite site, FieldContainer container, DefinitionKind kind) {
        List<String> names = new ArrayList<>();
        for (Definition nested : container.nestedTypes()) {
            if (nested.definitionKind() == kind) {
                names.add(NamingUtils.qualify(site.fqn(), nested.name()));
            }
        }
        for (FieldDef field : container.fields()) {
            boolean inline = kind == DefinitionKind.ENUM
                ? field.type() instanceof TypeExpr.InlineEnum
                : field.type() instanceof TypeExpr.InlineEmbed;
            if (inline) {
                names.add(NamingUtils.qualify(site.fqn(), field.name()));
            }
        }
        return names;
    }

    /** Nearest datasource declared on the namespace or one of its ancestors. */
    private static String inheritedDatasource(String namespaceFqn, Map<String, String> datasources) {
        String namespace = namespaceFqn;
        while (true) {
            String datasource = datasources.get(namespace);
            if (datasource != null || namespace.isEmpty()) {
                return datasource;
            }
            namespace = NamingUtils.parentOf(namespace);
        }
    }
}
