package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A literal value in a constraint or annotation argument.
 *
 * <p>String literals hold their unescaped contents; numbers hold their source text,
 * including a leading sign; identifiers hold the dotted path as written.
 *
 * @param kind literal category
 * @param text literal value as text
 * @param location source position
 */
public record Literal(
    LiteralKind kind,
    String text,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public Literal {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    public boolean isNumeric() {
        return kind == LiteralKind.INTEGER || kind == LiteralKind.FLOAT;
    }

    /**
     * Numeric value of an integer or float literal.
     *
     * @return decimal value
     * @throws IllegalStateException if the literal is not numeric
     */
    public BigDecimal asDecimal() {
        if (!isNumeric()) {
            throw new IllegalStateException("Literal is not numeric: " + text);
        }
        return new BigDecimal(text);
    }

    public boolean asBoolean() {
        return Boolean.parseBoolean(text);
    }

    @Override
    public String toString() {
        return kind == LiteralKind.STRING ? "\"" + text + "\"" : text;
    }
}
