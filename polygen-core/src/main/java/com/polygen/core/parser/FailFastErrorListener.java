package com.polygen.core.parser;

import com.polygen.core.diagnostic.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the first ANTLR syntax error into a {@link SchemaSyntaxException}.
 */
class FailFastErrorListener extends BaseErrorListener {

    private static final Logger log = LoggerFactory.getLogger(FailFastErrorListener.class);

    private final String file;

    FailFastErrorListener(String file) {
        this.file = file;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        String offending = offendingSymbol instanceof Token token ? token.getText() : null;
        String expected = recognizer instanceof Parser parser ? expectedTokens(parser, e) : null;
        SourceLocation location = new SourceLocation(file, line, charPositionInLine + 1);
        throw new SchemaSyntaxException(msg, location, offending, expected);
    }

    private String expectedTokens(Parser parser, RecognitionException e) {
        try {
            IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
            return expected != null ? expected.toString(parser.getVocabulary()) : null;
        } catch (IllegalArgumentException ex) {
            log.debug("Expected token set unavailable in {}: {}", file, ex.getMessage());
            return null;
        }
    }
}
