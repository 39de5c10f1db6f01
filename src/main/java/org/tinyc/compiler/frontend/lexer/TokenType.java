package org.tinyc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Bookkeeping.
    /** Represents the end of the source file. */
    END_OF_FILE,
    /** Represents an unrecognized character, a bare ':' or an unterminated comment. */
    ERROR,

    // Reserved words.
    /** The reserved word {@code if}. */
    IF,
    /** The reserved word {@code then}. */
    THEN,
    /** The reserved word {@code else}. */
    ELSE,
    /** The reserved word {@code end}. */
    END,
    /** The reserved word {@code repeat}. */
    REPEAT,
    /** The reserved word {@code until}. */
    UNTIL,
    /** The reserved word {@code read}. */
    READ,
    /** The reserved word {@code write}. */
    WRITE,

    // Multicharacter tokens.
    /** An identifier, a sequence of letters that is not a reserved word. */
    IDENTIFIER,
    /** A numeric literal, a sequence of decimal digits. */
    NUMBER,

    // Special symbols.
    /** The assignment operator ':='. */
    ASSIGN,
    /** The '=' comparison. */
    EQ,
    /** The '<' comparison. */
    LT,
    /** The '+' operator. */
    PLUS,
    /** The '-' operator. */
    MINUS,
    /** The '*' operator. */
    TIMES,
    /** The '/' operator. */
    OVER,
    /** The '(' character. */
    LPAREN,
    /** The ')' character. */
    RPAREN,
    /** The ';' statement separator. */
    SEMI;

    /**
     * @return {@code true} for the eight reserved words.
     */
    public boolean isReservedWord() {
        return ordinal() >= IF.ordinal() && ordinal() <= WRITE.ordinal();
    }
}
