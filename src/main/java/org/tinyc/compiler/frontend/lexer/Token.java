package org.tinyc.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Number, a reserved word).
 * @param text The text of the token from the source code, cut off at the maximum token length.
 *             Empty for {@link TokenType#END_OF_FILE}.
 * @param line The number of the source line the scanner was on when the token was completed.
 * @param fileName The logical file name of the source this token originates from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        String fileName
) {
}
