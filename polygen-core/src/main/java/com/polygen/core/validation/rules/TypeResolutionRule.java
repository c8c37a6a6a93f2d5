package com.polygen.core.validation.rules;

import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

/**
 * Reports field types that name no definition.
 */
public class TypeResolutionRule implements ValidationRule {

    @Override
    public String getName() {
        return "type-resolution";
    }

    @Override
    public void validate(ValidationContext context) {
        for (TypeSite site : context.symbols().sites()) {
            if (!(site.definition() instanceof FieldContainer container)) {
                continue;
            }
            for (FieldDef field : container.fields()) {
                if (field.type() instanceof TypeExpr.Named named
                    && context.symbols().resolve(named.path(), site.innerScope()).isEmpty()) {
                    context.report(DiagnosticKind.UNRESOLVED_TYPE,
                        "Unknown type '" + named.path() + "' for field '" + site.fqn() + "." + field.name() + "'",
                        field.location());
                }
            }
        }
    }
}
