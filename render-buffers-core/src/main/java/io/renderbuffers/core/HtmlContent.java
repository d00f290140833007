package io.renderbuffers.core;

import java.io.IOException;
import java.io.Writer;

/**
 * A value that renders itself as markup.
 *
 * <p>{@link ViewBufferTextWriter#write(Object)} appends such values as content rather than
 * converting them with {@link String#valueOf(Object)}.
 */
@FunctionalInterface
public interface HtmlContent {

    /**
     * Write this content to {@code out}, encoding any unencoded text it holds with {@code encoder}.
     */
    void writeTo(Writer out, HtmlEncoder encoder) throws IOException;
}
