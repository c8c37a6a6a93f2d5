package com.polygen.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SchemaParser}.
 */
class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser();

    @Test
    void parse_withValidSchema_returnsTree() {
        ParsedSchema parsed = parser.parse("game.poly", """
            import "common.poly";
            namespace game {
                table Player {
                    id: u32 primary_key;
                    name: string max_length(32);
                }
            }
            """);

        assertThat(parsed.file()).isEqualTo("game.poly");
        assertThat(parsed.tree().topLevelItem()).hasSize(2);
    }

    @Test
    void parse_withEmptyText_returnsEmptyTree() {
        ParsedSchema parsed = parser.parse("empty.poly", "");

        assertThat(parsed.tree().topLevelItem()).isEmpty();
    }

    @Test
    void parse_withMissingSemicolon_throwsWithPosition() {
        assertThatThrownBy(() -> parser.parse("bad.poly", """
            table Player {
                id: u32 primary_key
            }
            """))
            .isInstanceOf(SchemaSyntaxException.class)
            .satisfies(e -> {
                SchemaSyntaxException ex = (SchemaSyntaxException) e;
                assertThat(ex.getLine()).isEqualTo(3);
                assertThat(ex.getOffendingToken()).isEqualTo("}");
                assertThat(ex.getExpected()).contains("';'");
            });
    }

    @Test
    void parse_withUnknownCharacter_throwsSyntaxException() {
        assertThatThrownBy(() -> parser.parse("bad.poly", "table Player { id: u32 # ; }"))
            .isInstanceOf(SchemaSyntaxException.class);
    }

    @Test
    void parse_withKeywordsAsFieldNames_accepts() {
        ParsedSchema parsed = parser.parse("kw.poly", """
            table Entry {
                index: u32 primary_key;
                default: string;
                as: bool;
            }
            """);

        assertThat(parsed.tree().topLevelItem()).hasSize(1);
    }

    @Test
    void toDiagnostic_reportsSyntaxErrorKind() {
        try {
            parser.parse("bad.poly", "table {");
            fail("expected SchemaSyntaxException");
        } catch (SchemaSyntaxException e) {
            assertThat(e.toDiagnostic().kind().displayName()).isEqualTo("SyntaxError");
            assertThat(e.toDiagnostic().location().file()).isEqualTo("bad.poly");
        }
    }
}
