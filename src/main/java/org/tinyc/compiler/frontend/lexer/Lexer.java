package org.tinyc.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tinyc.compiler.diagnostics.DiagnosticsEngine;

import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the characters of a TINY
 * source file into tokens, one token per call to {@link #getToken()}.
 * <p>
 * Scanning is driven by a DFA over {@link ScanState}. Identifiers and numbers are scanned
 * with maximal munch and one character of lookahead, which is returned to the
 * {@link LineBuffer} when it belongs to the next token. After every call the buffer is
 * positioned at the first character that is not part of the returned token.
 * <p>
 * Each instance owns its buffer and line counter, so independent lexers do not interfere.
 * An instance is not thread-safe.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final LineBuffer buffer;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final LexerOptions options;
    private final PrintWriter trace;

    /**
     * Creates a Lexer over an in-memory source with default options.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(new StringReader(source), "<memory>", LexerOptions.defaults(), diagnostics, null);
    }

    /**
     * Creates a Lexer over a reader. The same writer serves as listing for source echo
     * and as sink for the token trace.
     *
     * @param source The source; owned and closed by the caller.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     * @param options Echo, trace and length settings.
     * @param diagnostics The engine for reporting errors.
     * @param listing The listing sink; may be {@code null} if neither echo nor trace is enabled.
     */
    public Lexer(Reader source, String logicalFileName, LexerOptions options,
                 DiagnosticsEngine diagnostics, PrintWriter listing) {
        this(new LineBuffer(source, options.bufferLength(), options.echoSource(), listing),
                logicalFileName, options, diagnostics, listing);
    }

    /**
     * Creates a Lexer on top of an existing line buffer.
     *
     * @param buffer The line buffer to pull characters from.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     * @param options Trace and length settings; echo is a property of the buffer.
     * @param diagnostics The engine for reporting errors.
     * @param trace The trace sink; may be {@code null} if tracing is disabled.
     */
    public Lexer(LineBuffer buffer, String logicalFileName, LexerOptions options,
                 DiagnosticsEngine diagnostics, PrintWriter trace) {
        if (options.traceScan() && trace == null) {
            throw new IllegalArgumentException("Tracing requires a trace sink");
        }
        this.buffer = buffer;
        this.logicalFileName = logicalFileName;
        this.options = options;
        this.diagnostics = diagnostics;
        this.trace = trace;
    }

    /**
     * Scans the next token.
     * <p>
     * Malformed input never raises an exception; it yields a {@link TokenType#ERROR} token
     * carrying the offending text and a diagnostic, and the next call continues behind it.
     * Once the source is exhausted every call returns {@link TokenType#END_OF_FILE}.
     *
     * @return The next token.
     * @throws java.io.UncheckedIOException if reading the source fails.
     */
    public Token getToken() {
        StringBuilder lexeme = new StringBuilder();
        TokenType currentToken = null;
        ScanState state = ScanState.START;
        int commentLine = 0;

        while (state != ScanState.DONE) {
            int c = buffer.nextChar();
            boolean save = true;

            switch (state) {
                case START:
                    if (isDigit(c)) {
                        state = ScanState.IN_NUMBER;
                    } else if (isLetter(c)) {
                        state = ScanState.IN_IDENTIFIER;
                    } else if (c == '{') {
                        save = false;
                        state = ScanState.IN_COMMENT;
                        commentLine = buffer.getLineNumber();
                    } else if (isWhitespace(c)) {
                        save = false;
                    } else if (c == ':') {
                        state = ScanState.IN_ASSIGN;
                    } else {
                        state = ScanState.DONE;
                        currentToken = singleCharacter(c);
                        if (c == LineBuffer.EOF) {
                            save = false;
                        } else if (currentToken == TokenType.ERROR) {
                            diagnostics.reportError("Unexpected character: " + (char) c, logicalFileName, buffer.getLineNumber());
                        }
                    }
                    break;
                case IN_COMMENT:
                    save = false;
                    if (c == '}') {
                        state = ScanState.START;
                    } else if (c == LineBuffer.EOF) {
                        state = ScanState.DONE;
                        currentToken = TokenType.ERROR;
                        lexeme.append('{');
                        diagnostics.reportError("Unterminated comment", logicalFileName, commentLine);
                    }
                    break;
                case IN_ASSIGN:
                    state = ScanState.DONE;
                    if (c == '=') {
                        currentToken = TokenType.ASSIGN;
                    } else {
                        buffer.putBack();
                        save = false;
                        currentToken = TokenType.ERROR;
                        diagnostics.reportError("Expected '=' after ':'", logicalFileName, buffer.getLineNumber());
                    }
                    break;
                case IN_NUMBER:
                    if (!isDigit(c)) {
                        buffer.putBack();
                        save = false;
                        state = ScanState.DONE;
                        currentToken = TokenType.NUMBER;
                    }
                    break;
                case IN_IDENTIFIER:
                    if (!isLetter(c)) {
                        buffer.putBack();
                        save = false;
                        state = ScanState.DONE;
                        currentToken = TokenType.IDENTIFIER;
                    }
                    break;
                default:
                    throw new IllegalStateException("Scanner entered unexpected state " + state);
            }

            // Characters beyond the limit are consumed but not stored.
            if (save && lexeme.length() < options.maxTokenLength()) {
                lexeme.append((char) c);
            }
            if (state == ScanState.DONE && currentToken == TokenType.IDENTIFIER) {
                currentToken = ReservedWords.lookup(lexeme.toString());
            }
        }

        Token token = new Token(currentToken, lexeme.toString(), buffer.getLineNumber(), logicalFileName);
        if (options.traceScan()) {
            trace.println(TokenPrinter.traceLine(token));
        }
        LOG.debug("{}:{}: {} '{}'", logicalFileName, token.line(), token.type(), token.text());
        return token;
    }

    /**
     * Scans the remaining source.
     * @return The tokens up to and including the {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = getToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * @return The number of source lines read so far.
     */
    public int getLineNumber() {
        return buffer.getLineNumber();
    }

    private static TokenType singleCharacter(int c) {
        switch (c) {
            case LineBuffer.EOF: return TokenType.END_OF_FILE;
            case '+': return TokenType.PLUS;
            case '-': return TokenType.MINUS;
            case '*': return TokenType.TIMES;
            case '/': return TokenType.OVER;
            case ';': return TokenType.SEMI;
            case '(': return TokenType.LPAREN;
            case ')': return TokenType.RPAREN;
            case '<': return TokenType.LT;
            case '=': return TokenType.EQ;
            default: return TokenType.ERROR;
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }
}
