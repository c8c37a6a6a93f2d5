package com.polygen.core.ir;

import com.polygen.core.ast.Cardinality;
import com.polygen.core.ast.ConstraintKind;
import com.polygen.core.util.NamingUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the relationship graph from one-sided foreign-key declarations.
 *
 * <p>Each foreign key becomes one {@link RelationshipIr}. The forward multiplicity
 * follows the field's cardinality; the reverse side is {@code 1} for a scalar or
 * optional key field and {@code *} otherwise. Without an {@code as} name the reverse
 * navigation is the lower-camel plural of the source table, disambiguated with
 * {@code By<Field>} when one table points at the same target more than once.
 */
public class RelationshipInferrer {

    /**
     * Infers one relationship per foreign key, in table then field order.
     *
     * @param tables tables in declaration order
     * @return relationships
     */
    public List<RelationshipIr> relationships(Collection<TableIr> tables) {
        List<RelationshipIr> relationships = new ArrayList<>();
        for (TableIr table : tables) {
            Map<String, Integer> unnamedPerTarget = new HashMap<>();
            for (FieldIr field : table.fields()) {
                ForeignKeyRef fk = field.foreignKey();
                if (fk != null && fk.relationName() == null) {
                    unnamedPerTarget.merge(fk.targetTable(), 1, Integer::sum);
                }
            }

            for (FieldIr field : table.fields()) {
                ForeignKeyRef fk = field.foreignKey();
                if (fk == null) {
                    continue;
                }
                boolean explicit = fk.relationName() != null;
                String reverseName = explicit
                    ? fk.relationName()
                    : defaultReverseName(table.name(), field.name(), unnamedPerTarget.get(fk.targetTable()) > 1);
                relationships.add(new RelationshipIr(
                    table.fqn(),
                    field.name(),
                    fk.targetTable(),
                    fk.targetField(),
                    Multiplicity.fromCardinality(field.type().modifier()),
                    reverseName,
                    reverseMultiplicity(field),
                    explicit));
            }
        }
        return relationships;
    }

    /**
     * Finds junction tables: exactly two scalar foreign keys pointing at two different tables.
     *
     * @param tables tables in declaration order
     * @return one record per junction table
     */
    public List<ManyToManyIr> junctions(Collection<TableIr> tables) {
        List<ManyToManyIr> junctions = new ArrayList<>();
        for (TableIr table : tables) {
            List<FieldIr> foreignKeys = table.fields().stream()
                .filter(f -> f.foreignKey() != null)
                .toList();
            if (foreignKeys.size() != 2) {
                continue;
            }
            FieldIr left = foreignKeys.get(0);
            FieldIr right = foreignKeys.get(1);
            if (left.type().modifier() != Cardinality.SCALAR || right.type().modifier() != Cardinality.SCALAR) {
                continue;
            }
            if (left.foreignKey().targetTable().equals(right.foreignKey().targetTable())) {
                continue;
            }
            junctions.add(new ManyToManyIr(table.fqn(),
                left.foreignKey().targetTable(), left.name(),
                right.foreignKey().targetTable(), right.name()));
        }
        return junctions;
    }

    static String defaultReverseName(String sourceTable, String fieldName, boolean ambiguous) {
        String plural = NamingUtils.toLowerCamel(NamingUtils.pluralize(sourceTable));
        return ambiguous ? plural + "By" + NamingUtils.toPascalCase(fieldName) : plural;
    }

    private static Multiplicity reverseMultiplicity(FieldIr field) {
        boolean key = field.hasConstraint(ConstraintKind.PRIMARY_KEY) || field.hasConstraint(ConstraintKind.UNIQUE);
        return key && field.type().modifier() != Cardinality.ARRAY ? Multiplicity.ONE : Multiplicity.MANY;
    }
}
