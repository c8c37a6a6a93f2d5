package com.polygen.core.validation.rules;

import com.polygen.core.ast.Cardinality;
import com.polygen.core.ast.Constraint;
import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.Literal;
import com.polygen.core.ast.LiteralKind;
import com.polygen.core.ast.PrimitiveType;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.util.NamingUtils;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Checks that each constraint's parameters fit the declared type of its field.
 *
 * <p>Foreign keys are checked by {@link ForeignKeyRule}. Fields whose type does not
 * resolve are skipped; {@link TypeResolutionRule} reports them.
 */
public class ConstraintCompatibilityRule implements ValidationRule {

    @Override
    public String getName() {
        return "constraint-compatibility";
    }

    @Override
    public void validate(ValidationContext context) {
        for (TypeSite site : context.symbols().sites()) {
            if (!(site.definition() instanceof FieldContainer container)) {
                continue;
            }
            for (FieldDef field : container.fields()) {
                FieldType fieldType = FieldType.of(context, field, site);
                if (fieldType == null) {
                    continue;
                }
                for (Constraint constraint : field.constraints()) {
                    check(context, site.fqn() + "." + field.name(), field, fieldType, constraint);
                }
            }
        }
    }

    private void check(ValidationContext context, String fieldName, FieldDef field, FieldType type, Constraint constraint) {
        String problem = switch (constraint.kind()) {
            case PRIMARY_KEY, UNIQUE, INDEX -> keyProblem(field, type);
            case AUTO_INCREMENT -> type.primitive != null && type.primitive.isInteger() && field.cardinality() != Cardinality.ARRAY
                ? null : "auto_increment requires a scalar integer field";
            case MAX_LENGTH -> type.primitive != null && (type.primitive.isText() || type.primitive.isBinary())
                ? null : "max_length requires a string or bytes field";
            case REGEX -> type.primitive != null && type.primitive.isText()
                ? null : "regex requires a string field";
            case RANGE -> rangeProblem(type, (Constraint.Range) constraint);
            case DEFAULT -> defaultProblem(field, type, ((Constraint.Default) constraint).value());
            case AUTO_CREATE, AUTO_UPDATE -> type.primitive != null && type.primitive.isTimestamp()
                ? null : constraint.kind().keyword() + " requires a timestamp field";
            case FOREIGN_KEY -> null;
        };
        if (problem != null) {
            context.report(DiagnosticKind.CONSTRAINT_TYPE_MISMATCH,
                problem + " ('" + fieldName + "' is " + field.type().displayName() + field.cardinality().suffix() + ")",
                constraint.location());
        }
    }

    private String keyProblem(FieldDef field, FieldType type) {
        if (field.cardinality() == Cardinality.ARRAY) {
            return "Key constraints cannot be applied to array fields";
        }
        if (type.site != null && type.site.isEmbed()) {
            return "Key constraints cannot be applied to embed fields";
        }
        return null;
    }

    private String rangeProblem(FieldType type, Constraint.Range range) {
        if (type.primitive == null || !type.primitive.isNumeric()) {
            return "range requires a numeric field";
        }
        for (Literal bound : new Literal[] {range.min(), range.max()}) {
            String boundProblem = numberProblem(type.primitive, bound);
            if (boundProblem != null) {
                return "range bound " + bound + ": " + boundProblem;
            }
        }
        if (range.min().asDecimal().compareTo(range.max().asDecimal()) > 0) {
            return "range lower bound " + range.min() + " is greater than upper bound " + range.max();
        }
        return null;
    }

    private String defaultProblem(FieldDef field, FieldType type, Literal value) {
        if (field.cardinality() == Cardinality.ARRAY) {
            return "default cannot be applied to array fields";
        }
        if (type.site != null) {
            if (!(type.site.definition() instanceof EnumDef enumDef)) {
                return "default is only supported on primitive and enum fields";
            }
            if (value.kind() != LiteralKind.IDENTIFIER) {
                return "default of an enum field must name a variant";
            }
            String variant = NamingUtils.simpleName(value.text());
            return enumDef.variant(variant).isPresent()
                ? null : "'" + variant + "' is not a variant of enum " + enumDef.name();
        }

        PrimitiveType primitive = type.primitive;
        if (primitive.isNumeric()) {
            return numberProblem(primitive, value);
        }
        if (primitive.isBoolean()) {
            return value.kind() == LiteralKind.BOOLEAN ? null : "default of a bool field must be true or false";
        }
        if (primitive.isText() || primitive.isBinary()) {
            return value.kind() == LiteralKind.STRING ? null : "default of a " + primitive + " field must be a string";
        }
        if (primitive.isTimestamp()) {
            return value.kind() == LiteralKind.STRING || value.kind() == LiteralKind.INTEGER
                ? null : "default of a timestamp field must be a string or epoch milliseconds";
        }
        return null;
    }

    private String numberProblem(PrimitiveType primitive, Literal value) {
        if (!value.isNumeric()) {
            return "expected a number";
        }
        if (primitive.isInteger() && value.kind() == LiteralKind.FLOAT) {
            return "expected an integer";
        }
        if (primitive.isUnsigned() && value.asDecimal().compareTo(BigDecimal.ZERO) < 0) {
            return "negative value for unsigned type " + primitive;
        }
        return null;
    }

    /**
     * Resolved type of a field: either a primitive or a type site.
     */
    private static final class FieldType {
        private final PrimitiveType primitive;
        private final TypeSite site;

        private FieldType(PrimitiveType primitive, TypeSite site) {
            this.primitive = primitive;
            this.site = site;
        }

        /** Returns null when the field's type does not resolve. */
        static FieldType of(ValidationContext context, FieldDef field, TypeSite owner) {
            if (field.type() instanceof TypeExpr.Primitive primitive) {
                return new FieldType(primitive.type(), null);
            }
            Optional<TypeSite> site = context.symbols().resolveFieldType(field, owner);
            return site.map(s -> new FieldType(null, s)).orElse(null);
        }
    }
}
