package io.renderbuffers.core;

import java.io.IOException;
import java.util.Objects;

/**
 * Base class for render buffer related exceptions.
 *
 * <p>{@link ConcurrentUse} and {@link Faulted} signal caller defects and are never retried.
 * {@link UncheckedIo} carries a sink failure across a {@link java.util.concurrent.CompletableFuture}
 * boundary; the original {@link IOException} is its cause.
 */
public abstract class RenderBufferException extends RuntimeException {

    protected RenderBufferException(String message) {
        super(message);
    }

    protected RenderBufferException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a writer is used while a flush it started is still draining.
     */
    public static class ConcurrentUse extends RenderBufferException {
        public ConcurrentUse(String message) {
            super(message);
        }
    }

    /**
     * Raised when a writer is used after a drain or sink flush failed.
     */
    public static class Faulted extends RenderBufferException {
        public Faulted(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Wraps an {@link IOException} raised by a sink inside an asynchronous operation.
     */
    public static class UncheckedIo extends RenderBufferException {
        public UncheckedIo(IOException cause) {
            super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
