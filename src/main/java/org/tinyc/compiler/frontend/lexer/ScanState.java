package org.tinyc.compiler.frontend.lexer;

/**
 * States of the scanner's DFA. Every call to {@link Lexer#getToken()} starts in {@link #START}.
 */
enum ScanState {
    START,
    IN_ASSIGN,
    IN_COMMENT,
    IN_NUMBER,
    IN_IDENTIFIER,
    DONE
}
