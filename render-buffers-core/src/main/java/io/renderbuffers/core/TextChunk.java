package io.renderbuffers.core;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One unit of buffered output.
 *
 * <p>Chunks keep their value in its original form; conversion to text (and encoding, when the
 * chunk is buffered as unencoded text) is deferred until the chunk is written out.
 */
public sealed interface TextChunk permits TextChunk.Text, TextChunk.Char, TextChunk.CharSlice, TextChunk.Int {

    /**
     * Minimum scratch size accepted by {@link #writeTo(Writer, HtmlEncoder, char[])}; fits {@link Integer#MIN_VALUE}.
     */
    int SCRATCH_SIZE = 11;

    /**
     * Number of characters this chunk produces before encoding.
     */
    int length();

    /**
     * Write this chunk to {@code out}.
     *
     * @param out destination
     * @param encoder encoding policy, or {@code null} when the chunk is already markup
     * @param scratch reusable buffer of at least {@link #SCRATCH_SIZE} chars
     */
    void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException;

    /**
     * Asynchronous counterpart of {@link #writeTo(Writer, HtmlEncoder, char[])}.
     *
     * @param encoder encoding policy, or {@code null} when the chunk is already markup
     */
    CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder);

    static TextChunk of(String value) {
        return new Text(value);
    }

    static TextChunk of(char value) {
        return new Char(value);
    }

    static TextChunk of(char[] chars, int offset, int length) {
        return new CharSlice(chars, offset, length);
    }

    static TextChunk of(int value) {
        return new Int(value);
    }

    record Text(String value) implements TextChunk {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public int length() {
            return value.length();
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            if (encoder == null) {
                out.write(value);
            } else {
                encoder.encode(out, value);
            }
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            return sink.write(encoder == null ? value : encoder.encode(value));
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Char(char value) implements TextChunk {
        @Override
        public int length() {
            return 1;
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            if (encoder == null) {
                out.write(value);
            } else {
                scratch[0] = value;
                encoder.encode(out, scratch, 0, 1);
            }
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            String text = String.valueOf(value);
            return sink.write(encoder == null ? text : encoder.encode(text));
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * A range of a caller-owned array. The array is not copied; it must stay unchanged until
     * the chunk has been written or copied out.
     */
    record CharSlice(char[] chars, int offset, int length) implements TextChunk {
        public CharSlice {
            Objects.requireNonNull(chars, "chars");
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be >= 0: " + offset);
            }
            if (length < 0) {
                throw new IllegalArgumentException("length must be >= 0: " + length);
            }
            if (length > chars.length - offset) {
                throw new IllegalArgumentException(
                        "offset + length exceeds array length: " + offset + " + " + length + " > " + chars.length);
            }
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            if (encoder == null) {
                out.write(chars, offset, length);
            } else {
                encoder.encode(out, chars, offset, length);
            }
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            if (encoder == null) {
                return sink.write(chars, offset, length);
            }
            return sink.write(encoder.encode(toString()));
        }

        @Override
        public String toString() {
            return new String(chars, offset, length);
        }
    }

    record Int(int value) implements TextChunk {
        @Override
        public int length() {
            int n = value < 0 ? 2 : 1;
            long v = Math.abs((long) value);
            while (v >= 10) {
                v /= 10;
                n++;
            }
            return n;
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            int start = format(value, scratch);
            int count = scratch.length - start;
            if (encoder == null) {
                out.write(scratch, start, count);
            } else {
                encoder.encode(out, scratch, start, count);
            }
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            // the sink may still hold the array after this returns, so it cannot be shared
            char[] digits = new char[SCRATCH_SIZE];
            int start = format(value, digits);
            if (encoder == null) {
                return sink.write(digits, start, digits.length - start);
            }
            return sink.write(encoder.encode(new String(digits, start, digits.length - start)));
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }

        /**
         * Format {@code value} right-aligned into {@code scratch}; returns the index of the first char.
         */
        static int format(int value, char[] scratch) {
            if (scratch.length < SCRATCH_SIZE) {
                throw new IllegalArgumentException("scratch must hold at least " + SCRATCH_SIZE + " chars");
            }
            long v = value;
            boolean negative = v < 0;
            if (negative) v = -v;
            int pos = scratch.length;
            do {
                scratch[--pos] = (char) ('0' + (int) (v % 10));
                v /= 10;
            } while (v != 0);
            if (negative) {
                scratch[--pos] = '-';
            }
            return pos;
        }
    }
}
