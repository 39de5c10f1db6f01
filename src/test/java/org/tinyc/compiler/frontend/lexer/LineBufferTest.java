package org.tinyc.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LineBuffer}: refill, put-back and the end-of-file latch.
 */
@Tag("unit")
class LineBufferTest {

    @Test
    void nextChar_returnsCharactersAcrossLines() {
        LineBuffer buffer = new LineBuffer(new StringReader("ab\nc"), 16);

        assertThat(buffer.nextChar()).isEqualTo('a');
        assertThat(buffer.getLineNumber()).isEqualTo(1);
        assertThat(buffer.nextChar()).isEqualTo('b');
        assertThat(buffer.nextChar()).isEqualTo('\n');
        assertThat(buffer.getLineNumber()).isEqualTo(1);
        assertThat(buffer.nextChar()).isEqualTo('c');
        assertThat(buffer.getLineNumber()).isEqualTo(2);
        assertThat(buffer.nextChar()).isEqualTo(LineBuffer.EOF);
        assertThat(buffer.nextChar()).isEqualTo(LineBuffer.EOF);
        assertThat(buffer.isAtEof()).isTrue();
        assertThat(buffer.getLineNumber()).isEqualTo(2);
    }

    @Test
    void putBack_returnsSameCharacterAgain() {
        LineBuffer buffer = new LineBuffer(new StringReader("xy"), 16);

        assertThat(buffer.nextChar()).isEqualTo('x');
        assertThat(buffer.nextChar()).isEqualTo('y');
        buffer.putBack();

        assertThat(buffer.nextChar()).isEqualTo('y');
    }

    @Test
    void putBack_isIgnoredAfterEndOfFile() {
        LineBuffer buffer = new LineBuffer(new StringReader("z"), 16);
        buffer.nextChar();
        assertThat(buffer.nextChar()).isEqualTo(LineBuffer.EOF);

        buffer.putBack();
        buffer.putBack();
        buffer.putBack();

        assertThat(buffer.nextChar()).isEqualTo(LineBuffer.EOF);
    }

    @Test
    void putBack_withoutConsumedCharacterFails() {
        LineBuffer buffer = new LineBuffer(new StringReader("z"), 16);

        assertThatThrownBy(buffer::putBack).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptySource_isEndOfFileOnLineZero() {
        LineBuffer buffer = new LineBuffer(new StringReader(""), 16);

        assertThat(buffer.nextChar()).isEqualTo(LineBuffer.EOF);
        assertThat(buffer.getLineNumber()).isZero();
    }

    /**
     * A line longer than the buffer is read in chunks; only the first chunk counts as a new line.
     */
    @Test
    void longLine_isReadInChunksOnOneLineNumber() {
        StringWriter listing = new StringWriter();
        LineBuffer buffer = new LineBuffer(new StringReader("abcdefghij\nk"), 4, true, new PrintWriter(listing, true));

        StringBuilder read = new StringBuilder();
        for (int c = buffer.nextChar(); c != '\n'; c = buffer.nextChar()) {
            read.append((char) c);
        }
        assertThat(read).hasToString("abcdefghij");
        assertThat(buffer.getLineNumber()).isEqualTo(1);

        assertThat(buffer.nextChar()).isEqualTo('k');
        assertThat(buffer.getLineNumber()).isEqualTo(2);
        assertThat(listing.toString().split("\\R")).containsExactly(
                "   1: abcd",
                "   1: efgh",
                "   1: ij",
                "   2: k");
    }

    @Test
    void echo_writesEachLineBeforeItsFirstCharacter() {
        StringWriter listing = new StringWriter();
        LineBuffer buffer = new LineBuffer(new StringReader("one\ntwo\n"), 255, true, new PrintWriter(listing, true));

        buffer.nextChar();

        assertThat(listing.toString()).isEqualTo("   1: one\n");
    }

    @Test
    void readFailure_isPropagated() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };
        LineBuffer buffer = new LineBuffer(failing, 16);

        assertThatThrownBy(buffer::nextChar)
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk gone");
    }

    @Test
    void invalidConstruction_isRejected() {
        assertThatThrownBy(() -> new LineBuffer(new StringReader(""), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LineBuffer(new StringReader(""), 8, true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
