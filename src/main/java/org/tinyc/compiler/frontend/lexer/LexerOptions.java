package org.tinyc.compiler.frontend.lexer;

import com.typesafe.config.Config;

/**
 * Settings that control a {@link Lexer} and its {@link LineBuffer}.
 *
 * @param echoSource Whether every line read is echoed to the listing sink.
 * @param traceScan Whether every emitted token is written to the trace sink.
 * @param maxTokenLength The maximum number of characters stored for a lexeme.
 * @param bufferLength The maximum number of characters one buffer refill reads.
 */
public record LexerOptions(
        boolean echoSource,
        boolean traceScan,
        int maxTokenLength,
        int bufferLength
) {
    /** Default maximum lexeme length. */
    public static final int DEFAULT_MAX_TOKEN_LENGTH = 40;
    /** Default line buffer capacity. */
    public static final int DEFAULT_BUFFER_LENGTH = 255;

    private static final String ECHO_SOURCE_KEY = "echo-source";
    private static final String TRACE_SCAN_KEY = "trace-scan";
    private static final String MAX_TOKEN_LENGTH_KEY = "max-token-length";
    private static final String BUFFER_LENGTH_KEY = "buffer-length";

    public LexerOptions {
        if (maxTokenLength < 1) {
            throw new IllegalArgumentException("max-token-length must be positive, was " + maxTokenLength);
        }
        if (bufferLength < 1) {
            throw new IllegalArgumentException("buffer-length must be positive, was " + bufferLength);
        }
    }

    /**
     * @return Options with echo and trace disabled and the default limits.
     */
    public static LexerOptions defaults() {
        return new LexerOptions(false, false, DEFAULT_MAX_TOKEN_LENGTH, DEFAULT_BUFFER_LENGTH);
    }

    /**
     * Reads options from a lexer configuration block such as {@code tinyc.lexer}.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The configuration block.
     * @return The resulting options.
     */
    public static LexerOptions fromConfig(final Config config) {
        return new LexerOptions(
                config.hasPath(ECHO_SOURCE_KEY) && config.getBoolean(ECHO_SOURCE_KEY),
                config.hasPath(TRACE_SCAN_KEY) && config.getBoolean(TRACE_SCAN_KEY),
                config.hasPath(MAX_TOKEN_LENGTH_KEY) ? config.getInt(MAX_TOKEN_LENGTH_KEY) : DEFAULT_MAX_TOKEN_LENGTH,
                config.hasPath(BUFFER_LENGTH_KEY) ? config.getInt(BUFFER_LENGTH_KEY) : DEFAULT_BUFFER_LENGTH);
    }

    public LexerOptions withEchoSource(boolean echo) {
        return new LexerOptions(echo, traceScan, maxTokenLength, bufferLength);
    }

    public LexerOptions withTraceScan(boolean trace) {
        return new LexerOptions(echoSource, trace, maxTokenLength, bufferLength);
    }
}
