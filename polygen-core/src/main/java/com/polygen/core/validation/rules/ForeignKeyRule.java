package com.polygen.core.validation.rules;

import com.polygen.core.ast.Constraint;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.TableDef;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.validation.SymbolTable;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.util.Optional;

/**
 * Checks that each foreign key targets a key field of an existing table and has the
 * same type as that field.
 *
 * <p>Foreign keys are only allowed on table fields of primitive or enum type.
 */
public class ForeignKeyRule implements ValidationRule {

    @Override
    public String getName() {
        return "foreign-keys";
    }

    @Override
    public void validate(ValidationContext context) {
        SymbolTable symbols = context.symbols();
        for (TypeSite site : symbols.sites()) {
            if (!(site.definition() instanceof FieldContainer container)) {
                continue;
            }
            for (FieldDef field : container.fields()) {
                field.foreignKey().ifPresent(foreignKey -> check(context, site, field, foreignKey));
            }
        }
    }

    private void check(ValidationContext context, TypeSite site, FieldDef field, Constraint.ForeignKey foreignKey) {
        SymbolTable symbols = context.symbols();
        String fieldName = site.fqn() + "." + field.name();

        if (!site.isTable()) {
            context.report(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH,
                "foreign_key on '" + fieldName + "' is only allowed on table fields", foreignKey.location());
            return;
        }

        Optional<TypeSite> fieldType = symbols.resolveFieldType(field, site);
        if (fieldType.isPresent() && fieldType.get().isEmbed()) {
            context.report(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH,
                "foreign_key cannot be applied to embed field '" + fieldName + "'", foreignKey.location());
            return;
        }

        String targetDescription = foreignKey.targetTable() + "." + foreignKey.targetField();
        Optional<TypeSite> target = symbols.resolveForeignKeyTarget(foreignKey.targetTable(), site);
        if (target.isEmpty()) {
            context.report(DiagnosticKind.UNRESOLVED_FOREIGN_KEY,
                "Foreign key target table '" + foreignKey.targetTable() + "' of '" + fieldName + "' does not exist",
                foreignKey.location());
            return;
        }
        if (!(target.get().definition() instanceof TableDef targetTable)) {
            context.report(DiagnosticKind.UNRESOLVED_FOREIGN_KEY,
                "Foreign key target '" + target.get().fqn() + "' of '" + fieldName + "' is not a table",
                foreignKey.location(), target.get().definition().location());
            return;
        }

        Optional<FieldDef> targetField = targetTable.field(foreignKey.targetField());
        if (targetField.isEmpty()) {
            context.report(DiagnosticKind.UNRESOLVED_FOREIGN_KEY,
                "Foreign key target field '" + targetDescription + "' of '" + fieldName + "' does not exist",
                foreignKey.location(), targetTable.location());
            return;
        }
        if (!targetField.get().isUniqueKey()) {
            context.report(DiagnosticKind.UNRESOLVED_FOREIGN_KEY,
                "Foreign key target '" + targetDescription + "' must be primary_key or unique",
                foreignKey.location(), targetField.get().location());
            return;
        }

        if (!sameType(symbols, field, site, targetField.get(), target.get())) {
            context.report(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH,
                "Type of '" + fieldName + "' (" + field.type().displayName() + ") does not match foreign key target '"
                    + targetDescription + "' (" + targetField.get().type().displayName() + ")",
                foreignKey.location(), targetField.get().location());
        }
    }

    private boolean sameType(SymbolTable symbols, FieldDef field, TypeSite site, FieldDef targetField, TypeSite targetSite) {
        if (field.type() instanceof TypeExpr.Primitive primitive) {
            return targetField.type() instanceof TypeExpr.Primitive targetPrimitive
                && primitive.type() == targetPrimitive.type();
        }
        Optional<TypeSite> own = symbols.resolveFieldType(field, site);
        Optional<TypeSite> other = symbols.resolveFieldType(targetField, targetSite);
        // Unresolved names are reported by type resolution.
        if (own.isEmpty() || other.isEmpty()) {
            return true;
        }
        return own.get().fqn().equals(other.get().fqn());
    }
}
