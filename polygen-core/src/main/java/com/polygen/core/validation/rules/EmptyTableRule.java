package com.polygen.core.validation.rules;

import com.polygen.core.ast.TableDef;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

/**
 * Warns about tables without fields.
 */
public class EmptyTableRule implements ValidationRule {

    @Override
    public String getName() {
        return "empty-tables";
    }

    @Override
    public void validate(ValidationContext context) {
        for (TypeSite site : context.symbols().sites()) {
            if (site.definition() instanceof TableDef table && table.fields().isEmpty()) {
                context.report(DiagnosticKind.EMPTY_TABLE, "Table '" + site.fqn() + "' has no fields", table.location());
            }
        }
    }
}
