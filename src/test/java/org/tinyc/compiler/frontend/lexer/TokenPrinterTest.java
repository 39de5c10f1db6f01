package org.tinyc.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the listing format of {@link TokenPrinter}.
 */
@Tag("unit")
class TokenPrinterTest {

    private static Token token(TokenType type, String text) {
        return new Token(type, text, 7, "t.tny");
    }

    @Test
    void describe_usesListingFormat() {
        assertThat(TokenPrinter.describe(token(TokenType.UNTIL, "until"))).isEqualTo("reserved word: until");
        assertThat(TokenPrinter.describe(token(TokenType.ASSIGN, ":="))).isEqualTo(":=");
        assertThat(TokenPrinter.describe(token(TokenType.OVER, "/"))).isEqualTo("/");
        assertThat(TokenPrinter.describe(token(TokenType.NUMBER, "42"))).isEqualTo("NUM, val= 42");
        assertThat(TokenPrinter.describe(token(TokenType.IDENTIFIER, "fact"))).isEqualTo("ID, name= fact");
        assertThat(TokenPrinter.describe(token(TokenType.ERROR, "!"))).isEqualTo("ERROR: !");
        assertThat(TokenPrinter.describe(token(TokenType.END_OF_FILE, ""))).isEqualTo("EOF");
    }

    @Test
    void traceLine_prefixesLineNumber() {
        assertThat(TokenPrinter.traceLine(token(TokenType.SEMI, ";"))).isEqualTo("\t7: ;");
    }
}
