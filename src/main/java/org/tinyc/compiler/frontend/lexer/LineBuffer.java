package org.tinyc.compiler.frontend.lexer;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * Holds one line of source text at a time and hands it out character by character.
 * <p>
 * When the buffer is exhausted it is refilled with the next line of the source. A refill reads
 * up to and including the next {@code '\n'}, but never more than the buffer capacity; a longer
 * physical line therefore arrives in several chunks, and only the first chunk advances the line
 * counter. Once the end of the source has been reached, {@link #nextChar()} keeps returning
 * {@link #EOF} and {@link #putBack()} has no effect.
 * <p>
 * The reader is owned by the caller and is never closed by this class.
 */
public class LineBuffer {

    /** Sentinel returned by {@link #nextChar()} once the source is exhausted. */
    public static final int EOF = -1;

    private final Reader source;
    private final PrintWriter listing;
    private final boolean echoSource;
    private final char[] line;
    private int length = 0;
    private int position = 0;
    private int lineNumber = 0;
    private boolean eof = false;
    private boolean atLineStart = true;

    /**
     * Creates a line buffer without echo.
     * @param source The source to read from.
     * @param capacity The maximum number of characters held at once.
     */
    public LineBuffer(Reader source, int capacity) {
        this(source, capacity, false, null);
    }

    /**
     * Creates a line buffer.
     * @param source The source to read from.
     * @param capacity The maximum number of characters held at once.
     * @param echoSource Whether each chunk read is echoed to the listing.
     * @param listing The listing sink; may be {@code null} if echo is disabled.
     */
    public LineBuffer(Reader source, int capacity, boolean echoSource, PrintWriter listing) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be positive, was " + capacity);
        }
        if (echoSource && listing == null) {
            throw new IllegalArgumentException("Echo requires a listing sink");
        }
        this.source = source;
        this.line = new char[capacity];
        this.echoSource = echoSource;
        this.listing = listing;
    }

    /**
     * Returns the next character of the source, refilling the buffer if needed.
     * @return The next character, or {@link #EOF} at the end of the source.
     * @throws UncheckedIOException if the underlying reader fails.
     */
    public int nextChar() {
        if (position < length) {
            return line[position++];
        }
        if (eof) {
            return EOF;
        }
        if (!refill()) {
            eof = true;
            return EOF;
        }
        return line[position++];
    }

    /**
     * Steps back one character so that the next call to {@link #nextChar()} returns it again.
     * Does nothing once the end of the source has been reached.
     */
    public void putBack() {
        if (eof) {
            return;
        }
        if (position == 0) {
            throw new IllegalStateException("Nothing to put back at line " + lineNumber);
        }
        position--;
    }

    /**
     * @return The number of physical lines read so far; {@code 0} before the first read.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return {@code true} once the end of the source has been reached.
     */
    public boolean isAtEof() {
        return eof;
    }

    private boolean refill() {
        int count = 0;
        try {
            while (count < line.length) {
                int c = source.read();
                if (c == -1) {
                    break;
                }
                line[count++] = (char) c;
                if (c == '\n') {
                    break;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source after line " + lineNumber, e);
        }
        if (count == 0) {
            return false;
        }

        if (atLineStart) {
            lineNumber++;
        }
        atLineStart = line[count - 1] == '\n';
        length = count;
        position = 0;

        if (echoSource) {
            String chunk = new String(line, 0, count);
            listing.printf("%4d: %s", lineNumber, chunk);
            if (!atLineStart) {
                listing.println();
            }
        }
        return true;
    }
}
