package com.polygen.core.parser;

import com.polygen.parser.PolygenParser;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.Objects;

/**
 * Parse tree of one schema file together with the token stream it came from.
 *
 * <p>The token stream is kept so doc comments on the hidden channel can be attached
 * to declarations.
 *
 * @param file source path
 * @param tree root of the parse tree
 * @param tokens token stream including hidden-channel tokens
 */
public record ParsedSchema(
    String file,
    PolygenParser.SchemaContext tree,
    CommonTokenStream tokens
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedSchema {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(tokens, "tokens must not be null");
    }
}
