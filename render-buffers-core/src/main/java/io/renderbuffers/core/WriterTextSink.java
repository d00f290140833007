package io.renderbuffers.core;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapter that exposes a blocking {@link Writer} as an {@link AsyncTextSink}.
 *
 * <p>Without an executor every operation runs on the calling thread and the returned future is
 * already complete. With an executor the blocking call is moved off the caller's thread:
 * <pre>{@code
 * ExecutorService io = Executors.newCachedThreadPool();
 * AsyncTextSink sink = new WriterTextSink(new OutputStreamWriter(socket.getOutputStream(), UTF_8), io);
 * }</pre>
 *
 * <p>{@link IOException}s complete the future exceptionally with a
 * {@link RenderBufferException.UncheckedIo} whose cause is the original exception.
 */
public final class WriterTextSink implements AsyncTextSink {

    private final Writer writer;
    private final Executor executor; // may be null

    public WriterTextSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.executor = null;
    }

    public WriterTextSink(Writer writer, Executor executor) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Void> write(String value) {
        Objects.requireNonNull(value, "value");
        return run(() -> writer.write(value));
    }

    @Override
    public CompletableFuture<Void> write(char[] chars, int offset, int length) {
        Objects.requireNonNull(chars, "chars");
        Objects.checkFromIndexSize(offset, length, chars.length);
        return run(() -> writer.write(chars, offset, length));
    }

    @Override
    public CompletableFuture<Void> flush() {
        return run(writer::flush);
    }

    /**
     * Returns the wrapped writer.
     */
    public Writer writer() {
        return writer;
    }

    private CompletableFuture<Void> run(IoAction action) {
        if (executor == null) {
            try {
                action.run();
                return CompletableFuture.completedFuture(null);
            } catch (IOException e) {
                return CompletableFuture.failedFuture(new RenderBufferException.UncheckedIo(e));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.runAsync(() -> {
            try {
                action.run();
            } catch (IOException e) {
                throw new RenderBufferException.UncheckedIo(e);
            }
        }, executor);
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
