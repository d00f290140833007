package io.renderbuffers.core;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Small list-backed builder for html assembled apart from the main {@link ViewBuffer}, for example
 * a component's output that is rendered ahead of time and written into the response later.
 *
 * <pre>{@code
 * HtmlFragment row = new HtmlFragment()
 *     .appendHtml("<td>")
 *     .append(user.name())
 *     .appendHtml("</td>");
 * writer.write(row); // moves the values into the writer's buffer
 * }</pre>
 */
public final class HtmlFragment implements HtmlContentBuilder, HtmlContentContainer {
    private final List<ViewBufferValue> values = new ArrayList<>();

    public int count() {
        return values.size();
    }

    @Override
    public HtmlFragment append(String unencoded) {
        if (unencoded != null && !unencoded.isEmpty()) {
            values.add(ViewBufferValue.text(TextChunk.of(unencoded)));
        }
        return this;
    }

    @Override
    public HtmlFragment appendHtml(String encoded) {
        if (encoded != null && !encoded.isEmpty()) {
            values.add(ViewBufferValue.markup(TextChunk.of(encoded)));
        }
        return this;
    }

    @Override
    public HtmlFragment appendHtml(HtmlContent content) {
        if (content != null) {
            values.add(ViewBufferValue.content(content));
        }
        return this;
    }

    @Override
    public HtmlFragment clear() {
        values.clear();
        return this;
    }

    @Override
    public void writeTo(Writer out, HtmlEncoder encoder) throws IOException {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(encoder, "encoder");
        char[] scratch = new char[TextChunk.SCRATCH_SIZE];
        for (ViewBufferValue value : values) {
            value.writeTo(out, encoder, scratch);
        }
    }

    @Override
    public void copyTo(HtmlContentBuilder destination) {
        Objects.requireNonNull(destination, "destination");
        for (ViewBufferValue value : values) {
            value.transferTo(destination, false);
        }
    }

    @Override
    public void moveTo(HtmlContentBuilder destination) {
        Objects.requireNonNull(destination, "destination");
        if (destination == this) {
            throw new IllegalArgumentException("Cannot move a fragment into itself");
        }
        for (ViewBufferValue value : values) {
            value.transferTo(destination, true);
        }
        values.clear();
    }

    @Override
    public String toString() {
        StringWriter out = new StringWriter();
        try {
            writeTo(out, HtmlEncoder.DEFAULT);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
