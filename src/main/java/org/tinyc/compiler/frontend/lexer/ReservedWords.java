package org.tinyc.compiler.frontend.lexer;

import java.util.List;

/**
 * The fixed table of reserved words.
 * <p>
 * Lookup is a linear scan in table order; the first exact, case-sensitive match wins.
 * New aliases must be appended so that existing entries keep precedence.
 */
public final class ReservedWords {

    private record Entry(String word, TokenType type) {}

    private static final List<Entry> TABLE = List.of(
            new Entry("if", TokenType.IF),
            new Entry("then", TokenType.THEN),
            new Entry("else", TokenType.ELSE),
            new Entry("end", TokenType.END),
            new Entry("repeat", TokenType.REPEAT),
            new Entry("until", TokenType.UNTIL),
            new Entry("read", TokenType.READ),
            new Entry("write", TokenType.WRITE)
    );

    private ReservedWords() {}

    /**
     * Classifies an identifier-shaped lexeme.
     * @param lexeme The complete lexeme.
     * @return The reserved word's type, or {@link TokenType#IDENTIFIER} if the lexeme is not reserved.
     */
    public static TokenType lookup(String lexeme) {
        for (Entry entry : TABLE) {
            if (entry.word().equals(lexeme)) {
                return entry.type();
            }
        }
        return TokenType.IDENTIFIER;
    }

    /**
     * @return The number of reserved words.
     */
    public static int size() {
        return TABLE.size();
    }
}
