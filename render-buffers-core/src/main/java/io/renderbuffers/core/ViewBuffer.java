package io.renderbuffers.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only buffer of rendered output.
 *
 * <p>Values are kept in insertion order in pages rented from a {@link ViewBufferPagePool}. Text
 * appended with {@link #append(String)} is encoded when the buffer is written out; markup
 * appended with {@link #appendHtml(String)} is written verbatim.
 *
 * <p>Not thread-safe. A buffer is owned by a single render and must not be appended to while
 * {@link #writeTo} or {@link #writeToAsync} is in progress. {@link #clear()} is only called after
 * a drain completed successfully; after a failed drain the content that reached the sink is not
 * tracked and the buffer should be discarded together with the response.
 */
public final class ViewBuffer implements HtmlContentBuilder, HtmlContentContainer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ViewBuffer.class);

    private final ViewBufferPagePool pool;
    private final List<ViewBufferPage> pages = new ArrayList<>();
    private int count;

    public ViewBuffer() {
        this(ViewBufferPagePool.unpooled(ViewBufferOptions.DEFAULT_PAGE_SIZE));
    }

    public ViewBuffer(ViewBufferPagePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Number of buffered values.
     */
    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Pages currently in use; exposed for diagnostics.
     */
    public int pageCount() {
        return pages.size();
    }

    @Override
    public ViewBuffer append(String unencoded) {
        if (unencoded == null || unencoded.isEmpty()) {
            return this;
        }
        appendValue(ViewBufferValue.text(TextChunk.of(unencoded)));
        return this;
    }

    public ViewBuffer append(TextChunk chunk) {
        if (Objects.requireNonNull(chunk, "chunk").length() == 0) {
            return this;
        }
        appendValue(ViewBufferValue.text(chunk));
        return this;
    }

    @Override
    public ViewBuffer appendHtml(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return this;
        }
        appendValue(ViewBufferValue.markup(TextChunk.of(encoded)));
        return this;
    }

    public ViewBuffer appendHtml(TextChunk chunk) {
        if (Objects.requireNonNull(chunk, "chunk").length() == 0) {
            return this;
        }
        appendValue(ViewBufferValue.markup(chunk));
        return this;
    }

    @Override
    public ViewBuffer appendHtml(HtmlContent content) {
        if (content == null) {
            return this;
        }
        appendValue(ViewBufferValue.content(content));
        return this;
    }

    void appendValue(ViewBufferValue value) {
        Objects.requireNonNull(value, "value");
        ViewBufferPage page = pages.isEmpty() ? null : pages.get(pages.size() - 1);
        if (page == null || page.isFull()) {
            page = pool.rent();
            pages.add(page);
        }
        page.append(value);
        count++;
    }

    /**
     * Drops every buffered value and returns the pages to the pool.
     */
    @Override
    public ViewBuffer clear() {
        for (ViewBufferPage page : pages) {
            pool.release(page);
        }
        pages.clear();
        count = 0;
        return this;
    }

    /**
     * Writes all values to {@code out} in order. Sink failures propagate unchanged; values already
     * written are not retracted.
     */
    @Override
    public void writeTo(Writer out, HtmlEncoder encoder) throws IOException {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(encoder, "encoder");
        char[] scratch = new char[TextChunk.SCRATCH_SIZE];
        for (ViewBufferPage page : pages) {
            for (int i = 0; i < page.count(); i++) {
                page.get(i).writeTo(out, encoder, scratch);
            }
        }
        LOGGER.debug("Wrote {} buffered values in {} pages", count, pages.size());
    }

    /**
     * Writes all values to {@code sink} in order, one sink operation at a time.
     *
     * <p>Runs inline for as long as the sink completes its futures immediately and continues on
     * the sink's completion thread otherwise. A value is always written in full before the drain
     * suspends. The returned future fails with the sink's failure; values already written are not
     * retracted.
     */
    public CompletableFuture<Void> writeToAsync(AsyncTextSink sink, HtmlEncoder encoder) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(encoder, "encoder");
        int total = count;
        return drainFrom(sink, encoder, 0, 0)
                .thenRun(() -> LOGGER.debug("Wrote {} buffered values asynchronously", total));
    }

    private CompletableFuture<Void> drainFrom(AsyncTextSink sink, HtmlEncoder encoder, int pageIndex, int valueIndex) {
        int p = pageIndex;
        int v = valueIndex;
        while (p < pages.size()) {
            ViewBufferPage page = pages.get(p);
            if (v >= page.count()) {
                p++;
                v = 0;
                continue;
            }
            CompletableFuture<Void> written;
            try {
                written = page.get(v).writeToAsync(sink, encoder);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            v++;
            if (written.isCompletedExceptionally()) {
                return written;
            }
            if (!written.isDone()) {
                int nextPage = p;
                int nextValue = v;
                return written.thenCompose(ignored -> drainFrom(sink, encoder, nextPage, nextValue));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void copyTo(HtmlContentBuilder destination) {
        Objects.requireNonNull(destination, "destination");
        for (ViewBufferPage page : pages) {
            for (int i = 0; i < page.count(); i++) {
                page.get(i).transferTo(destination, false);
            }
        }
    }

    /**
     * Moves all values into {@code destination} and clears this buffer.
     */
    @Override
    public void moveTo(HtmlContentBuilder destination) {
        Objects.requireNonNull(destination, "destination");
        if (destination == this) {
            throw new IllegalArgumentException("Cannot move a buffer into itself");
        }
        for (ViewBufferPage page : pages) {
            for (int i = 0; i < page.count(); i++) {
                page.get(i).transferTo(destination, true);
            }
        }
        clear();
    }

    /**
     * Renders everything buffered so far without draining.
     */
    public String contentAsString(HtmlEncoder encoder) {
        StringWriter out = new StringWriter();
        try {
            writeTo(out, encoder);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return contentAsString(HtmlEncoder.DEFAULT);
    }
}
