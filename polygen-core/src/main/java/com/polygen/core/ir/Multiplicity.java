package com.polygen.core.ir;

import com.polygen.core.ast.Cardinality;

/**
 * Multiplicity of one end of a relationship.
 */
public enum Multiplicity {
    ONE("1"),
    ZERO_OR_ONE("0..1"),
    MANY("*");

    private final String symbol;

    Multiplicity(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Forward multiplicity implied by the cardinality of a foreign-key field.
     *
     * @param cardinality field cardinality
     * @return {@code 1}, {@code 0..1} or {@code *}
     */
    public static Multiplicity fromCardinality(Cardinality cardinality) {
        return switch (cardinality) {
            case SCALAR -> ONE;
            case OPTIONAL -> ZERO_OR_ONE;
            case ARRAY -> MANY;
        };
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
