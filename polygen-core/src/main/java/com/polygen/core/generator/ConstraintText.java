package com.polygen.core.generator;

import com.polygen.core.ast.Constraint;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders constraints back to their schema spelling, for documentation output.
 */
public final class ConstraintText {

    private ConstraintText() {
    }

    /**
     * Formats one constraint, e.g. {@code max_length(32)} or {@code foreign_key(game.Skill.id) as users}.
     *
     * @param constraint constraint to format
     * @return schema spelling
     */
    public static String format(Constraint constraint) {
        String keyword = constraint.kind().keyword();
        return switch (constraint.kind()) {
            case PRIMARY_KEY, UNIQUE, INDEX, AUTO_INCREMENT -> keyword;
            case MAX_LENGTH -> keyword + "(" + ((Constraint.MaxLength) constraint).length() + ")";
            case DEFAULT -> keyword + "(" + ((Constraint.Default) constraint).value() + ")";
            case RANGE -> {
                Constraint.Range range = (Constraint.Range) constraint;
                yield keyword + "(" + range.min() + ", " + range.max() + ")";
            }
            case REGEX -> keyword + "(\"" + ((Constraint.Regex) constraint).pattern() + "\")";
            case FOREIGN_KEY -> {
                Constraint.ForeignKey fk = (Constraint.ForeignKey) constraint;
                String text = keyword + "(" + fk.targetTable() + "." + fk.targetField() + ")";
                yield fk.relationName() != null ? text + " as " + fk.relationName() : text;
            }
            case AUTO_CREATE -> keyword + "(" + ((Constraint.AutoCreate) constraint).timezone() + ")";
            case AUTO_UPDATE -> keyword + "(" + ((Constraint.AutoUpdate) constraint).timezone() + ")";
        };
    }

    /**
     * Formats a constraint list separated by spaces.
     *
     * @param constraints constraints in source order
     * @return joined text, empty for no constraints
     */
    public static String formatAll(List<Constraint> constraints) {
        return constraints.stream().map(ConstraintText::format).collect(Collectors.joining(" "));
    }
}
