package org.tinyc.compiler.frontend.lexer;

/**
 * Renders tokens in the listing format used by the scan trace.
 */
public final class TokenPrinter {

    private TokenPrinter() {}

    /**
     * Describes a token, e.g. {@code reserved word: if}, {@code :=}, {@code NUM, val= 12},
     * {@code ID, name= x}, {@code ERROR: $} or {@code EOF}.
     *
     * @param token The token to describe.
     * @return The description, without a trailing newline.
     */
    public static String describe(Token token) {
        return switch (token.type()) {
            case IF, THEN, ELSE, END, REPEAT, UNTIL, READ, WRITE -> "reserved word: " + token.text();
            case ASSIGN -> ":=";
            case LT -> "<";
            case EQ -> "=";
            case LPAREN -> "(";
            case RPAREN -> ")";
            case SEMI -> ";";
            case PLUS -> "+";
            case MINUS -> "-";
            case TIMES -> "*";
            case OVER -> "/";
            case END_OF_FILE -> "EOF";
            case NUMBER -> "NUM, val= " + token.text();
            case IDENTIFIER -> "ID, name= " + token.text();
            case ERROR -> "ERROR: " + token.text();
        };
    }

    /**
     * Formats one line of the scan trace.
     * @param token The emitted token.
     * @return {@code "\t<line>: <description>"}.
     */
    public static String traceLine(Token token) {
        return "\t" + token.line() + ": " + describe(token);
    }
}
