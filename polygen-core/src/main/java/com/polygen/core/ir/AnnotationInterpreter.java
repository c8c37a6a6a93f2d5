package com.polygen.core.ir;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.AnnotationArgument;
import com.polygen.core.ast.AnnotationKind;
import com.polygen.core.ast.ConstraintKind;
import com.polygen.core.ast.Literal;
import com.polygen.core.ast.LiteralKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns recognized annotations into {@link TableOptions} and {@link IndexSpec}s.
 *
 * <p>Only runs on validated schemas, so required parameters are present.
 */
public class AnnotationInterpreter {

    private static final Set<String> DATA_SOURCE_KEYS = Set.of("type", "path");

    /**
     * Reads the {@code @datasource} name from a list of annotations.
     *
     * @param annotations namespace or table annotations
     * @return datasource name or null
     */
    public String datasource(List<Annotation> annotations) {
        return find(annotations, AnnotationKind.DATASOURCE)
            .flatMap(a -> a.parameter("name"))
            .map(Literal::text)
            .orElse(null);
    }

    /**
     * Interprets table annotations.
     *
     * @param annotations table annotations
     * @param inheritedDatasource datasource of the enclosing namespace, or null
     * @return interpreted options
     */
    public TableOptions tableOptions(List<Annotation> annotations, String inheritedDatasource) {
        String datasource = datasource(annotations);
        return new TableOptions(
            find(annotations, AnnotationKind.TAGGABLE).isPresent(),
            find(annotations, AnnotationKind.LINK_ROWS)
                .map(a -> new LinkRows(text(a, "partition_by"), text(a, "link_with")))
                .orElse(null),
            find(annotations, AnnotationKind.LOAD).map(this::dataSource).orElse(null),
            find(annotations, AnnotationKind.SAVE).map(this::dataSource).orElse(null),
            find(annotations, AnnotationKind.CACHE).map(a -> text(a, "strategy")).orElse(null),
            find(annotations, AnnotationKind.READONLY).isPresent(),
            find(annotations, AnnotationKind.SOFT_DELETE).map(a -> text(a, "field")).orElse(null),
            find(annotations, AnnotationKind.RENAMED_FROM).map(a -> text(a, "name")).orElse(null),
            datasource != null ? datasource : inheritedDatasource,
            find(annotations, AnnotationKind.OUTPUT).map(a -> text(a, "path")).orElse(null));
    }

    /**
     * Builds the index list of a table: one index per key or foreign-key field, then
     * one per {@code @index} annotation.
     *
     * @param tableName simple table name, used in index names
     * @param fields table fields
     * @param annotations table annotations
     * @return indexes in declaration order
     */
    public List<IndexSpec> indexes(String tableName, List<FieldIr> fields, List<Annotation> annotations) {
        List<IndexSpec> indexes = new ArrayList<>();
        for (FieldIr field : fields) {
            List<String> columns = List.of(field.name());
            boolean keyed = true;
            if (field.isPrimaryKey()) {
                indexes.add(new IndexSpec("pk_" + tableName, columns, true, IndexSpec.Source.PRIMARY_KEY));
            } else if (field.hasConstraint(ConstraintKind.UNIQUE)) {
                indexes.add(new IndexSpec("uq_" + tableName + "_" + field.name(), columns, true, IndexSpec.Source.UNIQUE));
            } else if (field.hasConstraint(ConstraintKind.INDEX)) {
                indexes.add(new IndexSpec("idx_" + tableName + "_" + field.name(), columns, false, IndexSpec.Source.INDEX));
            } else {
                keyed = false;
            }
            if (!keyed && field.foreignKey() != null) {
                indexes.add(new IndexSpec("fk_" + tableName + "_" + field.name(), columns, false, IndexSpec.Source.FOREIGN_KEY));
            }
        }

        for (Annotation annotation : annotations) {
            if (annotation.kind().orElse(null) != AnnotationKind.INDEX) {
                continue;
            }
            List<String> columns = annotation.positionalArguments().stream().map(Literal::text).toList();
            String name = annotation.namedArgument("name")
                .map(Literal::text)
                .orElse("idx_" + tableName + "_" + String.join("_", columns));
            boolean unique = annotation.namedArgument("unique").map(Literal::asBoolean).orElse(false);
            indexes.add(new IndexSpec(name, columns, unique, IndexSpec.Source.ANNOTATION));
        }
        return indexes;
    }

    private DataSourceSpec dataSource(Annotation annotation) {
        String typeName = text(annotation, "type");
        DataSourceType type = DataSourceType.fromName(typeName)
            .orElseThrow(() -> new IllegalStateException("Unknown data source type: " + typeName));
        String path = annotation.parameter("path").map(Literal::text).orElse(null);

        Map<String, String> params = new LinkedHashMap<>();
        for (AnnotationArgument argument : annotation.arguments()) {
            if (!argument.isPositional() && !DATA_SOURCE_KEYS.contains(argument.key())) {
                params.put(argument.key(), argument.value().text());
            }
        }
        return new DataSourceSpec(type, path, params);
    }

    private static Optional<Annotation> find(List<Annotation> annotations, AnnotationKind kind) {
        return annotations.stream()
            .filter(a -> a.kind().orElse(null) == kind)
            .findFirst();
    }

    private static String text(Annotation annotation, String key) {
        Literal literal = annotation.parameter(key)
            .orElseThrow(() -> new IllegalStateException("@" + annotation.name() + " is missing '" + key + "'"));
        return literal.kind() == LiteralKind.STRING || literal.kind() == LiteralKind.IDENTIFIER
            ? literal.text() : literal.toString();
    }
}
