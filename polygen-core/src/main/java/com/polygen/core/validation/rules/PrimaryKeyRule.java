package com.polygen.core.validation.rules;

import com.polygen.core.ast.Cardinality;
import com.polygen.core.ast.ConstraintKind;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.util.List;

/**
 * A table has at most one primary key, unless composite keys are enabled; primary
 * keys are not allowed inside embeds or on optional fields.
 */
public class PrimaryKeyRule implements ValidationRule {

    @Override
    public String getName() {
        return "primary-keys";
    }

    @Override
    public void validate(ValidationContext context) {
        for (TypeSite site : context.symbols().sites()) {
            if (!(site.definition() instanceof FieldContainer container)) {
                continue;
            }
            List<FieldDef> keys = container.fields().stream()
                .filter(f -> f.hasConstraint(ConstraintKind.PRIMARY_KEY))
                .toList();

            if (site.isEmbed()) {
                for (FieldDef key : keys) {
                    context.report(DiagnosticKind.INVALID_PRIMARY_KEY,
                        "primary_key is not allowed inside embed '" + site.fqn() + "'",
                        key.constraint(ConstraintKind.PRIMARY_KEY).orElseThrow().location());
                }
                continue;
            }

            for (FieldDef key : keys) {
                if (key.cardinality() == Cardinality.OPTIONAL) {
                    context.report(DiagnosticKind.INVALID_PRIMARY_KEY,
                        "primary_key field '" + site.fqn() + "." + key.name() + "' cannot be optional", key.location());
                }
            }
            if (keys.size() > 1 && !context.options().allowCompositePrimaryKeys()) {
                for (FieldDef extra : keys.subList(1, keys.size())) {
                    context.report(DiagnosticKind.INVALID_PRIMARY_KEY,
                        "Table '" + site.fqn() + "' declares more than one primary_key field ('"
                            + keys.get(0).name() + "' and '" + extra.name() + "')",
                        extra.location(), keys.get(0).location());
                }
            }
        }
    }
}
