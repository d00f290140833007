package io.renderbuffers.core;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A single buffered entry: either a {@link TextChunk} tagged with its provenance, or nested
 * {@link HtmlContent}.
 */
public sealed interface ViewBufferValue permits ViewBufferValue.Chunk, ViewBufferValue.Content {

    void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException;

    CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder);

    /**
     * Append this value to {@code destination}; nested containers are moved when {@code move} is set
     * and copied otherwise.
     */
    void transferTo(HtmlContentBuilder destination, boolean move);

    static ViewBufferValue text(TextChunk chunk) {
        return new Chunk(chunk, false);
    }

    static ViewBufferValue markup(TextChunk chunk) {
        return new Chunk(chunk, true);
    }

    static ViewBufferValue content(HtmlContent content) {
        return new Content(content);
    }

    /**
     * @param markup {@code true} if the chunk is already encoded and bypasses the encoder
     */
    record Chunk(TextChunk chunk, boolean markup) implements ViewBufferValue {
        public Chunk {
            Objects.requireNonNull(chunk, "chunk");
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            chunk.writeTo(out, markup ? null : encoder, scratch);
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            return chunk.writeToAsync(sink, markup ? null : encoder);
        }

        @Override
        public void transferTo(HtmlContentBuilder destination, boolean move) {
            if (destination instanceof ViewBuffer buffer) {
                buffer.appendValue(this);
            } else if (markup) {
                destination.appendHtml(chunk.toString());
            } else {
                destination.append(chunk.toString());
            }
        }
    }

    record Content(HtmlContent content) implements ViewBufferValue {
        public Content {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public void writeTo(Writer out, HtmlEncoder encoder, char[] scratch) throws IOException {
            content.writeTo(out, encoder);
        }

        @Override
        public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
            if (content instanceof ViewBuffer nested) {
                return nested.writeToAsync(sink, encoder);
            }
            StringWriter rendered = new StringWriter();
            try {
                content.writeTo(rendered, encoder);
            } catch (IOException e) {
                return CompletableFuture.failedFuture(new RenderBufferException.UncheckedIo(e));
            }
            return sink.write(rendered.toString());
        }

        @Override
        public void transferTo(HtmlContentBuilder destination, boolean move) {
            if (content instanceof HtmlContentContainer container) {
                if (move) {
                    container.moveTo(destination);
                } else {
                    container.copyTo(destination);
                }
            } else {
                destination.appendHtml(content);
            }
        }
    }
}
