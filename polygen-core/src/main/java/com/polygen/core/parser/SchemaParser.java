package com.polygen.core.parser;

import com.polygen.parser.PolygenLexer;
import com.polygen.parser.PolygenParser;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses schema source text with the generated ANTLR lexer and parser.
 *
 * <p>Parsing is fail-fast: the first lexer or parser error aborts with a
 * {@link SchemaSyntaxException} carrying the position, the offending token and the
 * expected token set.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParsedSchema parsed = new SchemaParser().parse("game.poly", text);
 * SchemaFile file = new SchemaAstBuilder().build(parsed);
 * }</pre>
 */
public class SchemaParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    /**
     * Parses one schema file.
     *
     * @param file path used in locations
     * @param text file contents
     * @return parse tree and token stream
     * @throws SchemaSyntaxException on the first syntax error
     */
    public ParsedSchema parse(String file, String text) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(text, "text must not be null");

        FailFastErrorListener errorListener = new FailFastErrorListener(file);

        CharStream input = CharStreams.fromString(text, file);
        PolygenLexer lexer = new PolygenLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PolygenParser parser = new PolygenParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        PolygenParser.SchemaContext tree = parser.schema();
        log.debug("Parsed {} ({} tokens)", file, tokens.size());
        return new ParsedSchema(file, tree, tokens);
    }
}
