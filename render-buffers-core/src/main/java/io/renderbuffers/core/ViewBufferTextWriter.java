package io.renderbuffers.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Writer} that buffers everything written to it in a {@link ViewBuffer} and copies the
 * buffer to its {@link OutputTarget} when flushed.
 *
 * <p>Writes are always synchronous and never touch the target. {@link #flush()} and
 * {@link #flushAsync()} drain the buffer to a {@link OutputTarget.Terminal} target, clear it and
 * flush the target; rendering then continues into the emptied buffer. With an
 * {@link OutputTarget.None} or {@link OutputTarget.Nested} target, flushing does nothing and
 * content accumulates until read with {@link #toString()} or moved elsewhere.
 *
 * <p>Text written through this writer is treated as markup and is not encoded. The configured
 * {@link HtmlEncoder} is handed to {@link HtmlContent} values when they write themselves.
 *
 * <p>A writer has a single logical caller. The render loop and whoever calls
 * {@link #flushAsync()} must not overlap; any write or flush issued while a flush is draining
 * fails with {@link RenderBufferException.ConcurrentUse}. The check detects the overlap, it does
 * not serialize it. If a drain fails the writer becomes {@link WriterState#FAULTED} and rejects
 * further use with {@link RenderBufferException.Faulted}.
 */
public final class ViewBufferTextWriter extends Writer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ViewBufferTextWriter.class);

    private final ViewBuffer buffer;
    private final OutputTarget target;
    private final HtmlEncoder encoder;
    private final String newLine;
    private final AtomicReference<WriterState> state = new AtomicReference<>(WriterState.IDLE);
    private volatile Throwable fault;
    private volatile boolean closed;

    /**
     * Creates an in-memory writer whose flush never drains.
     */
    public ViewBufferTextWriter(ViewBuffer buffer) {
        this(buffer, OutputTarget.NONE, ViewBufferOptions.defaults());
    }

    /**
     * Creates a writer that drains to {@code inner} when flushed.
     *
     * @param inner destination; another {@link ViewBufferTextWriter} makes flushing a no-op
     */
    public ViewBufferTextWriter(ViewBuffer buffer, HtmlEncoder encoder, Writer inner) {
        this(buffer, OutputTarget.of(Objects.requireNonNull(inner, "inner")),
                ViewBufferOptions.builder().encoder(Objects.requireNonNull(encoder, "encoder")).build());
    }

    public ViewBufferTextWriter(ViewBuffer buffer, OutputTarget target, ViewBufferOptions options) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.target = Objects.requireNonNull(target, "target");
        Objects.requireNonNull(options, "options");
        this.encoder = options.encoder();
        this.newLine = options.newLine();
    }

    public ViewBuffer buffer() {
        return buffer;
    }

    public OutputTarget target() {
        return target;
    }

    public HtmlEncoder encoder() {
        return encoder;
    }

    public String newLine() {
        return newLine;
    }

    public WriterState state() {
        return state.get();
    }

    // ---- synchronous writes ----

    @Override
    public void write(int c) throws IOException {
        ensureWritable();
        buffer.appendHtml(TextChunk.of((char) c));
    }

    @Override
    public void write(char[] chars, int offset, int length) throws IOException {
        Objects.requireNonNull(chars, "chars");
        Objects.checkFromIndexSize(offset, length, chars.length);
        ensureWritable();
        if (length == 0) return;
        // callers may reuse the array once write returns, so the range is copied
        buffer.appendHtml(new String(chars, offset, length));
    }

    /**
     * Writes {@code value}; {@code null} and empty strings are ignored.
     */
    @Override
    public void write(String value) throws IOException {
        if (value == null || value.isEmpty()) {
            return;
        }
        ensureWritable();
        buffer.appendHtml(value);
    }

    @Override
    public void write(String value, int offset, int length) throws IOException {
        Objects.requireNonNull(value, "value");
        Objects.checkFromIndexSize(offset, length, value.length());
        write(value.substring(offset, offset + length));
    }

    @Override
    public ViewBufferTextWriter append(CharSequence csq) throws IOException {
        write(String.valueOf(csq));
        return this;
    }

    @Override
    public ViewBufferTextWriter append(CharSequence csq, int start, int end) throws IOException {
        CharSequence value = csq == null ? "null" : csq;
        write(value.subSequence(start, end).toString());
        return this;
    }

    @Override
    public ViewBufferTextWriter append(char c) throws IOException {
        write(c);
        return this;
    }

    /**
     * Writes the decimal text of {@code value}. Formatting is deferred until the buffer is drained.
     */
    public void writeValue(int value) throws IOException {
        ensureWritable();
        buffer.appendHtml(TextChunk.of(value));
    }

    /**
     * Writes an arbitrary value: {@link HtmlContentContainer}s move their content into the buffer,
     * other {@link HtmlContent} is appended as content, anything else is written as
     * {@link String#valueOf(Object)}. {@code null} is ignored.
     */
    public void write(Object value) throws IOException {
        if (value == null) {
            return;
        }
        if (value instanceof HtmlContentContainer container) {
            write(container);
        } else if (value instanceof HtmlContent content) {
            write(content);
        } else {
            write(value.toString());
        }
    }

    public void write(HtmlContent content) throws IOException {
        if (content == null) {
            return;
        }
        ensureWritable();
        buffer.appendHtml(content);
    }

    /**
     * Moves the content of {@code container} into this writer's buffer.
     */
    public void write(HtmlContentContainer container) throws IOException {
        if (container == null) {
            return;
        }
        ensureWritable();
        container.moveTo(buffer);
    }

    public void writeLine() throws IOException {
        ensureWritable();
        buffer.appendHtml(newLine);
    }

    public void writeLine(char value) throws IOException {
        write(value);
        writeLine();
    }

    public void writeLine(char[] chars, int offset, int length) throws IOException {
        write(chars, offset, length);
        writeLine();
    }

    public void writeLine(String value) throws IOException {
        write(value);
        writeLine();
    }

    /**
     * Writes {@code value} as {@link #write(Object)} does, followed by a new line. {@code null}
     * writes nothing at all.
     */
    public void writeLine(Object value) throws IOException {
        if (value == null) {
            return;
        }
        write(value);
        writeLine();
    }

    // ---- asynchronous writes: buffered synchronously, returned already complete ----

    public CompletableFuture<Void> writeAsync(char value) {
        return completed(() -> write(value));
    }

    public CompletableFuture<Void> writeAsync(char[] chars, int offset, int length) {
        return completed(() -> write(chars, offset, length));
    }

    public CompletableFuture<Void> writeAsync(String value) {
        return completed(() -> write(value));
    }

    public CompletableFuture<Void> writeLineAsync() {
        return completed(this::writeLine);
    }

    public CompletableFuture<Void> writeLineAsync(char value) {
        return completed(() -> writeLine(value));
    }

    public CompletableFuture<Void> writeLineAsync(char[] chars, int offset, int length) {
        return completed(() -> writeLine(chars, offset, length));
    }

    public CompletableFuture<Void> writeLineAsync(String value) {
        return completed(() -> writeLine(value));
    }

    private static CompletableFuture<Void> completed(IoAction action) {
        try {
            action.run();
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ---- flushing ----

    /**
     * Copies the buffered content to the target writer, clears the buffer and flushes the target.
     * Does nothing unless the target is {@link OutputTarget.Terminal}.
     */
    @Override
    public void flush() throws IOException {
        ensureOpen();
        if (!(target instanceof OutputTarget.Terminal terminal)) {
            LOGGER.trace("Flush ignored for {} target", target.getClass().getSimpleName());
            return;
        }
        beginDrain();
        try {
            buffer.writeTo(terminal.writer(), encoder);
            buffer.clear();
            terminal.writer().flush();
        } catch (IOException | RuntimeException e) {
            markFaulted(e);
            throw e;
        }
        state.set(WriterState.IDLE);
    }

    /**
     * Asynchronous counterpart of {@link #flush()} using the target's {@link AsyncTextSink}.
     *
     * <p>The writer stays {@link WriterState#DRAINING} until the returned future completes.
     * Usage errors are thrown immediately; sink failures complete the future exceptionally.
     */
    public CompletableFuture<Void> flushAsync() {
        if (closed) {
            return CompletableFuture.failedFuture(new IOException("Writer closed"));
        }
        if (!(target instanceof OutputTarget.Terminal terminal)) {
            LOGGER.trace("Async flush ignored for {} target", target.getClass().getSimpleName());
            return CompletableFuture.completedFuture(null);
        }
        beginDrain();
        AsyncTextSink sink = terminal.sink();
        CompletableFuture<Void> drained;
        try {
            drained = buffer.writeToAsync(sink, encoder);
        } catch (RuntimeException e) {
            markFaulted(e);
            throw e;
        }
        return drained
                .thenCompose(ignored -> {
                    buffer.clear();
                    return sink.flush();
                })
                .whenComplete((ignored, failure) -> {
                    if (failure == null) {
                        state.set(WriterState.IDLE);
                    } else {
                        markFaulted(failure);
                    }
                });
    }

    /**
     * Flushes and marks this writer closed. The target itself is not closed; its lifetime belongs
     * to the caller.
     */
    @Override
    public void close() throws IOException {
        if (closed) return;
        if (state.get() == WriterState.FAULTED) {
            closed = true;
            return;
        }
        try {
            flush();
        } finally {
            closed = true;
        }
    }

    /**
     * Returns everything currently buffered, encoded with this writer's encoder.
     */
    @Override
    public String toString() {
        return buffer.contentAsString(encoder);
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Writer closed");
        }
    }

    private void ensureWritable() throws IOException {
        ensureOpen();
        checkState(state.get());
    }

    private void beginDrain() {
        if (!state.compareAndSet(WriterState.IDLE, WriterState.DRAINING)) {
            checkState(state.get());
            // lost the race to another flush that has since finished
            throw new RenderBufferException.ConcurrentUse("Attempting to flush ViewBufferTextWriter concurrently");
        }
    }

    private void checkState(WriterState current) {
        if (current == WriterState.DRAINING) {
            throw new RenderBufferException.ConcurrentUse("Attempting to use ViewBufferTextWriter while a flush is in progress");
        }
        if (current == WriterState.FAULTED) {
            throw new RenderBufferException.Faulted("ViewBufferTextWriter is unusable after a failed flush", fault);
        }
    }

    private void markFaulted(Throwable failure) {
        // async stages wrap the sink failure; record the same cause a synchronous flush would
        if (failure instanceof CompletionException wrapped && wrapped.getCause() != null) {
            failure = wrapped.getCause();
        }
        fault = failure;
        state.set(WriterState.FAULTED);
        LOGGER.warn("Flush of {} buffered values failed; writer is now faulted", buffer.count(), failure);
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
