package com.polygen.core.validation.rules;

import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.EnumVariant;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.util.HashMap;
import java.util.Map;

/**
 * Warns when two variants of an enum end up with the same value. Implicit values
 * continue from the previous variant.
 */
public class DuplicateEnumValueRule implements ValidationRule {

    @Override
    public String getName() {
        return "duplicate-enum-values";
    }

    @Override
    public void validate(ValidationContext context) {
        for (TypeSite site : context.symbols().sites()) {
            if (!(site.definition() instanceof EnumDef enumDef)) {
                continue;
            }
            Map<Long, EnumVariant> byValue = new HashMap<>();
            long next = 0;
            for (EnumVariant variant : enumDef.variants()) {
                long value = variant.value() != null ? variant.value() : next;
                next = value + 1;
                EnumVariant first = byValue.putIfAbsent(value, variant);
                if (first != null) {
                    context.report(DiagnosticKind.DUPLICATE_ENUM_VALUE,
                        "Variants '" + first.name() + "' and '" + variant.name() + "' of enum '" + site.fqn()
                            + "' share value " + value,
                        variant.location(), first.location());
                }
            }
        }
    }
}
