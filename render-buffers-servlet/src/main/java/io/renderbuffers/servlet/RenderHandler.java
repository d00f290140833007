package io.renderbuffers.servlet;

import io.renderbuffers.core.ViewBufferTextWriter;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Produces the html for one request.
 *
 * <p>The handler writes into {@code writer} and calls {@link ViewBufferTextWriter#flush()} or
 * {@link ViewBufferTextWriter#flushAsync()} whenever a batch of output is ready to go to the
 * client. The returned stage completes when rendering is finished; the servlet then flushes
 * whatever is still buffered. A handler must not write while one of its own async flushes is
 * still outstanding.
 */
@FunctionalInterface
public interface RenderHandler {

    CompletionStage<Void> render(RenderRequest request, ViewBufferTextWriter writer) throws IOException;

    /**
     * Adapts a handler that finishes rendering before it returns.
     */
    static RenderHandler blocking(Blocking handler) {
        return (request, writer) -> {
            handler.render(request, writer);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface Blocking {
        void render(RenderRequest request, ViewBufferTextWriter writer) throws IOException;
    }
}
