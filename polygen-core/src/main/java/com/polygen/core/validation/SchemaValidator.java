package com.polygen.core.validation;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.Severity;
import com.polygen.core.imports.MergedSchema;
import com.polygen.core.validation.rules.AnnotationRule;
import com.polygen.core.validation.rules.ConstraintCompatibilityRule;
import com.polygen.core.validation.rules.DuplicateDefinitionRule;
import com.polygen.core.validation.rules.DuplicateEnumValueRule;
import com.polygen.core.validation.rules.EmptyTableRule;
import com.polygen.core.validation.rules.ForeignKeyRule;
import com.polygen.core.validation.rules.PrimaryKeyRule;
import com.polygen.core.validation.rules.TypeResolutionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the semantic checks over a merged schema.
 *
 * <p>Validation is not fail-fast: every rule runs and all diagnostics are returned,
 * in rule order. Downstream stages must not run while an error is outstanding.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Diagnostic> diagnostics = new SchemaValidator(ValidationOptions.defaults()).validate(merged);
 * if (Diagnostic.hasErrors(diagnostics)) {
 *     // report and stop
 * }
 * }</pre>
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final ValidationOptions options;
    private final List<ValidationRule> rules;

    public SchemaValidator() {
        this(ValidationOptions.defaults());
    }

    public SchemaValidator(ValidationOptions options) {
        this(options, defaultRules());
    }

    public SchemaValidator(ValidationOptions options, List<ValidationRule> rules) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.rules = List.copyOf(rules);
    }

    /**
     * The built-in rules in execution order.
     *
     * @return rule list
     */
    public static List<ValidationRule> defaultRules() {
        return List.of(
            new DuplicateDefinitionRule(),
            new TypeResolutionRule(),
            new ForeignKeyRule(),
            new ConstraintCompatibilityRule(),
            new AnnotationRule(),
            new PrimaryKeyRule(),
            new EmptyTableRule(),
            new DuplicateEnumValueRule()
        );
    }

    /**
     * Validates a merged schema.
     *
     * @param schema merged schema
     * @return all diagnostics found
     */
    public List<Diagnostic> validate(MergedSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        ValidationContext context = new ValidationContext(schema, SymbolTable.build(schema), options);

        for (ValidationRule rule : rules) {
            int before = context.diagnostics().size();
            rule.validate(context);
            log.debug("Rule {} reported {} diagnostics", rule.getName(), context.diagnostics().size() - before);
        }

        List<Diagnostic> diagnostics = context.diagnostics().stream()
            .map(d -> options.warningsAsErrors() && !d.isError() ? d.withSeverity(Severity.ERROR) : d)
            .toList();
        log.info("Validation finished with {} diagnostics", diagnostics.size());
        return diagnostics;
    }
}
