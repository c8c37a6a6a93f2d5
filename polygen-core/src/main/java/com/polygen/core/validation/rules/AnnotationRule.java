package com.polygen.core.validation.rules;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.AnnotationKind;
import com.polygen.core.ast.EnumDef;
import com.polygen.core.ast.EnumVariant;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.Literal;
import com.polygen.core.ast.LiteralKind;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.imports.MergedNamespace;
import com.polygen.core.validation.TypeSite;
import com.polygen.core.validation.ValidationContext;
import com.polygen.core.validation.ValidationRule;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the parameters of recognized annotations.
 *
 * <p>A missing required parameter is a {@link DiagnosticKind#MISSING_ANNOTATION_PARAMETER};
 * a parameter that names an unknown field or carries an unsupported value is a
 * {@link DiagnosticKind#INVALID_ANNOTATION_PARAMETER}. Unrecognized annotations are
 * not checked.
 */
public class AnnotationRule implements ValidationRule {

    private static final Set<String> DATA_SOURCE_TYPES = Set.of("db", "map", "memory");
    private static final String MAP_TYPE = "map";

    @Override
    public String getName() {
        return "annotations";
    }

    @Override
    public void validate(ValidationContext context) {
        for (MergedNamespace namespace : context.schema().namespaces()) {
            checkAll(context, namespace.annotations(), null);
        }
        for (TypeSite site : context.symbols().sites()) {
            if (site.definition() instanceof FieldContainer container) {
                checkAll(context, site.definition().annotations(), container);
                for (FieldDef field : container.fields()) {
                    checkAll(context, field.annotations(), null);
                }
            } else if (site.definition() instanceof EnumDef enumDef) {
                checkAll(context, enumDef.annotations(), null);
                for (EnumVariant variant : enumDef.variants()) {
                    checkAll(context, variant.annotations(), null);
                }
            }
        }
    }

    private void checkAll(ValidationContext context, List<Annotation> annotations, FieldContainer container) {
        for (Annotation annotation : annotations) {
            annotation.kind().ifPresent(kind -> check(context, annotation, kind, container));
        }
    }

    private void check(ValidationContext context, Annotation annotation, AnnotationKind kind, FieldContainer container) {
        if (kind == AnnotationKind.INDEX) {
            checkIndex(context, annotation, container);
            return;
        }

        Map<String, Literal> parameters = annotation.resolveParameters(kind.parameters());
        boolean complete = true;
        for (String required : kind.requiredParameters()) {
            if (!parameters.containsKey(required)) {
                context.report(DiagnosticKind.MISSING_ANNOTATION_PARAMETER,
                    "@" + annotation.name() + " requires parameter '" + required + "'", annotation.location());
                complete = false;
            }
        }
        if (!complete) {
            return;
        }

        switch (kind) {
            case LOAD, SAVE -> checkDataSource(context, annotation, parameters);
            case LINK_ROWS -> {
                checkFieldReference(context, annotation, "partition_by", parameters, container);
                checkFieldReference(context, annotation, "link_with", parameters, container);
            }
            case SOFT_DELETE -> checkFieldReference(context, annotation, "field", parameters, container);
            default -> {
                // no further checks
            }
        }
    }

    private void checkDataSource(ValidationContext context, Annotation annotation, Map<String, Literal> parameters) {
        Literal type = parameters.get("type");
        String normalized = type.text().toLowerCase(Locale.ROOT);
        if (!DATA_SOURCE_TYPES.contains(normalized)) {
            context.report(DiagnosticKind.INVALID_ANNOTATION_PARAMETER,
                "@" + annotation.name() + " type must be one of DB, Map, Memory, found '" + type.text() + "'",
                type.location());
            return;
        }
        if (MAP_TYPE.equals(normalized) && !parameters.containsKey("path")) {
            context.report(DiagnosticKind.MISSING_ANNOTATION_PARAMETER,
                "@" + annotation.name() + "(type: Map) requires parameter 'path'", annotation.location());
        }
    }

    private void checkIndex(ValidationContext context, Annotation annotation, FieldContainer container) {
        List<Literal> fields = annotation.positionalArguments();
        if (fields.isEmpty()) {
            context.report(DiagnosticKind.MISSING_ANNOTATION_PARAMETER,
                "@index requires at least one field name", annotation.location());
            return;
        }
        if (container == null) {
            return;
        }
        for (Literal field : fields) {
            checkField(context, annotation, "index", field, container);
        }
        Optional<Literal> unique = annotation.namedArgument("unique");
        if (unique.isPresent() && unique.get().kind() != LiteralKind.BOOLEAN) {
            context.report(DiagnosticKind.INVALID_ANNOTATION_PARAMETER,
                "@index unique must be true or false", unique.get().location());
        }
    }

    private void checkFieldReference(ValidationContext context, Annotation annotation, String parameter,
                                     Map<String, Literal> parameters, FieldContainer container) {
        Literal value = parameters.get(parameter);
        if (container != null && value != null) {
            checkField(context, annotation, parameter, value, container);
        }
    }

    private void checkField(ValidationContext context, Annotation annotation, String parameter, Literal value,
                            FieldContainer container) {
        if (container.field(value.text()).isEmpty()) {
            context.report(DiagnosticKind.INVALID_ANNOTATION_PARAMETER,
                "@" + annotation.name() + " " + parameter + " refers to unknown field '" + value.text()
                    + "' of '" + container.name() + "'",
                value.location());
        }
    }
}
