package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.Objects;

/**
 * A constraint attached to a field.
 *
 * <p>Each variant reports its {@link ConstraintKind}; consumers switch on the kind and
 * cast to the variant record when they need its parameters.
 */
public sealed interface Constraint {

    ConstraintKind kind();

    SourceLocation location();

    record PrimaryKey(SourceLocation location) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.PRIMARY_KEY;
        }
    }

    record Unique(SourceLocation location) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.UNIQUE;
        }
    }

    record Index(SourceLocation location) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.INDEX;
        }
    }

    record AutoIncrement(SourceLocation location) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.AUTO_INCREMENT;
        }
    }

    /**
     * @param length maximum length, always positive
     * @param location source position
     */
    record MaxLength(int length, SourceLocation location) implements Constraint {
        public MaxLength {
            if (length <= 0) {
                throw new IllegalArgumentException("max_length must be positive: " + length);
            }
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.MAX_LENGTH;
        }
    }

    record Default(Literal value, SourceLocation location) implements Constraint {
        public Default {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.DEFAULT;
        }
    }

    record Range(Literal min, Literal max, SourceLocation location) implements Constraint {
        public Range {
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.RANGE;
        }
    }

    record Regex(String pattern, SourceLocation location) implements Constraint {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.REGEX;
        }
    }

    /**
     * Reference to a key field of another table.
     *
     * @param targetTable table path as written, possibly relative ({@code Skill}, {@code game.Skill})
     * @param targetField referenced field name
     * @param relationName explicit reverse relation name, or null
     * @param location source position
     */
    record ForeignKey(String targetTable, String targetField, String relationName, SourceLocation location)
        implements Constraint {

        public ForeignKey {
            Objects.requireNonNull(targetTable, "targetTable must not be null");
            Objects.requireNonNull(targetField, "targetField must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.FOREIGN_KEY;
        }
    }

    record AutoCreate(Timezone timezone, SourceLocation location) implements Constraint {
        public AutoCreate {
            Objects.requireNonNull(timezone, "timezone must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.AUTO_CREATE;
        }
    }

    record AutoUpdate(Timezone timezone, SourceLocation location) implements Constraint {
        public AutoUpdate {
            Objects.requireNonNull(timezone, "timezone must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.AUTO_UPDATE;
        }
    }
}
