package io.renderbuffers.core;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous text destination that buffered output is drained to.
 *
 * <p>Each operation returns a future that completes once the text has been accepted (or flushed).
 * Callers issue one operation at a time and wait for its completion before the next, so an
 * implementation never sees overlapping calls from a single drain.
 *
 * <p>For adapting a blocking {@link java.io.Writer}, use {@link WriterTextSink}.
 */
public interface AsyncTextSink {

    CompletableFuture<Void> write(String value);

    /**
     * Write a range of {@code chars}. The array must not be modified until the returned future completes.
     */
    CompletableFuture<Void> write(char[] chars, int offset, int length);

    CompletableFuture<Void> flush();
}
