package io.renderbuffers.core;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Already-encoded markup.
 */
public record HtmlString(String value) implements HtmlContent {

    public static final HtmlString EMPTY = new HtmlString("");

    public static final HtmlString NEW_LINE = new HtmlString("\r\n");

    public HtmlString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public void writeTo(Writer out, HtmlEncoder encoder) throws IOException {
        out.write(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
