package io.renderbuffers.core;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Encoding policy applied to buffered text that is not already markup.
 *
 * <p>Implementations must be stateless; one instance is shared by every writer in the process.
 */
@FunctionalInterface
public interface HtmlEncoder {

    /**
     * Escapes {@code & < > " '} and passes everything else through.
     */
    HtmlEncoder DEFAULT = new DefaultHtmlEncoder();

    /**
     * Writes text unchanged.
     */
    HtmlEncoder NONE = Writer::write;

    /**
     * Encode {@code length} characters of {@code chars} starting at {@code offset} to {@code out}.
     */
    void encode(Writer out, char[] chars, int offset, int length) throws IOException;

    default void encode(Writer out, String value) throws IOException {
        char[] chars = value.toCharArray();
        encode(out, chars, 0, chars.length);
    }

    default String encode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringWriter out = new StringWriter(value.length() + 16);
        try {
            encode(out, value);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
