package com.polygen.core.validation.rules;

import com.polygen.core.ast.Definition;
import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.EnumVariant;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SourceLocation;
import com.polygen.core.imports.MergedNamespace;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reports names declared twice in the same scope: types in a namespace, nested types
 * and fields in a table or embed, and variants in an enum.
 */
public class DuplicateDefinitionRule implements ValidationRule {

    @Override
    public String getName() {
        return "duplicate-definitions";
    }

    @Override
    public void validate(ValidationContext context) {
        for (MergedNamespace namespace : context.schema().namespaces()) {
            String scopeName = namespace.isRoot() ? "the root namespace" : "namespace '" + namespace.fqn() + "'";
            checkUnique(context, namespace.types(), Definition::name, Definition::location, "Type", scopeName);
        }

        for (TypeSite site : context.symbols().sites()) {
            if (site.definition() instanceof FieldContainer container) {
                String scopeName = "'" + site.fqn() + "'";
                checkUnique(context, container.fields(), FieldDef::name, FieldDef::location, "Field", scopeName);
                checkUnique(context, container.nestedTypes(), Definition::name, Definition::location, "Type", scopeName);
                checkInlineNames(context, container, site.fqn());
            } else if (site.definition() instanceof EnumDef enumDef) {
                checkUnique(context, enumDef.variants(), EnumVariant::name, EnumVariant::location,
                    "Variant", "enum '" + site.fqn() + "'");
            }
        }
    }

    // An inline type is named <owner>.<field>, which must not shadow a nested type.
    private void checkInlineNames(ValidationContext context, FieldContainer container, String ownerFqn) {
        Map<String, Definition> nested = new HashMap<>();
        for (Definition definition : container.nestedTypes()) {
            nested.putIfAbsent(definition.name(), definition);
        }
        for (FieldDef field : container.fields()) {
            TypeExpr.Kind kind = field.type().kind();
            Definition clash = nested.get(field.name());
            if (clash != null && (kind == TypeExpr.Kind.INLINE_EMBED || kind == TypeExpr.Kind.INLINE_ENUM)) {
                context.report(DiagnosticKind.DUPLICATE_DEFINITION,
                    "Inline type of field '" + field.name() + "' clashes with nested type '"
                        + ownerFqn + "." + clash.name() + "'",
                    field.location(), clash.location());
            }
        }
    }

    private <T> void checkUnique(ValidationContext context, List<T> items, Function<T, String> name,
                                 Function<T, SourceLocation> location, String what, String scopeName) {
        Map<String, T> seen = new HashMap<>();
        for (T item : items) {
            T first = seen.putIfAbsent(name.apply(item), item);
            if (first != null) {
                context.report(DiagnosticKind.DUPLICATE_DEFINITION,
                    what + " '" + name.apply(item) + "' is already defined in " + scopeName,
                    location.apply(item), location.apply(first));
            }
        }
    }
}
