package io.renderbuffers.servlet;

import io.renderbuffers.core.OutputTarget;
import io.renderbuffers.core.ViewBuffer;
import io.renderbuffers.core.ViewBufferOptions;
import io.renderbuffers.core.ViewBufferPagePool;
import io.renderbuffers.core.ViewBufferTextWriter;
import io.renderbuffers.core.WriterState;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Servlet that streams the output of a {@link RenderHandler} to the response.
 *
 * <p>Each request gets its own {@link ViewBuffer} (pages come from a shared pool) and a
 * {@link ViewBufferTextWriter} over the response output stream. Content reaches the client every time the
 * handler flushes, and once more when rendering completes. Handlers that complete later switch the
 * request into async mode; the final flush then runs on the thread that completes the render.
 *
 * <p>If rendering fails before anything was sent, the response becomes a 500. Once content has been
 * committed it cannot be retracted, so the failure is only logged and the response ends.
 */
public final class StreamingRenderServlet extends HttpServlet {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingRenderServlet.class);

    static final String CONTENT_TYPE = "text/html;charset=UTF-8";

    private final transient RenderHandler handler;
    private final transient ViewBufferOptions options;
    private final transient ViewBufferPagePool pagePool;

    public StreamingRenderServlet(RenderHandler handler) {
        this(handler, ViewBufferOptions.defaults());
    }

    public StreamingRenderServlet(RenderHandler handler, ViewBufferOptions options) {
        this(handler, options, Objects.requireNonNull(options, "options").newPagePool());
    }

    public StreamingRenderServlet(RenderHandler handler, ViewBufferOptions options, ViewBufferPagePool pagePool) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.options = Objects.requireNonNull(options, "options");
        this.pagePool = Objects.requireNonNull(pagePool, "pagePool");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        RenderRequest request = toRenderRequest(req);
        resp.setStatus(HttpServletResponse.SC_OK);
        resp.setContentType(CONTENT_TYPE);

        // getWriter() is a PrintWriter, which hides I/O failures behind checkError()
        Writer out = new OutputStreamWriter(resp.getOutputStream(), StandardCharsets.UTF_8);
        ViewBufferTextWriter writer = new ViewBufferTextWriter(
                new ViewBuffer(pagePool), OutputTarget.of(out), options);

        CompletableFuture<Void> rendered;
        try {
            rendered = handler.render(request, writer).toCompletableFuture();
        } catch (IOException | RuntimeException e) {
            fail(request, resp, writer, e);
            return;
        }

        if (rendered.isDone()) {
            complete(request, resp, writer, rendered);
            return;
        }

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        rendered.whenComplete((ignored, failure) -> {
            try {
                complete(request, resp, writer, rendered);
            } finally {
                async.complete();
            }
        });
    }

    private void complete(RenderRequest request, HttpServletResponse resp, ViewBufferTextWriter writer, CompletableFuture<Void> rendered) {
        try {
            rendered.join();
            writer.flush();
            LOGGER.debug("Rendered {} {}", request.method(), request.path());
        } catch (CompletionException e) {
            fail(request, resp, writer, e.getCause() != null ? e.getCause() : e);
        } catch (IOException | RuntimeException e) {
            fail(request, resp, writer, e);
        }
    }

    private void fail(RenderRequest request, HttpServletResponse resp, ViewBufferTextWriter writer, Throwable failure) {
        if (resp.isCommitted()) {
            LOGGER.warn("Render of {} {} failed after the response was committed (writer {})",
                    request.method(), request.path(), writer.state(), failure);
            return;
        }
        LOGGER.warn("Render of {} {} failed", request.method(), request.path(), failure);
        if (writer.state() == WriterState.IDLE) {
            writer.buffer().clear();
        }
        resp.resetBuffer();
        resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
    }

    static RenderRequest toRenderRequest(HttpServletRequest req) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        Map<String, List<String>> parameters = new LinkedHashMap<>();
        Map<String, String[]> raw = req.getParameterMap();
        if (raw != null) {
            raw.forEach((k, v) -> parameters.put(k, v == null ? List.of() : Arrays.asList(v)));
        }

        String path = req.getRequestURI() == null ? "/" : req.getRequestURI();
        return new RenderRequest(req.getMethod(), path, parameters, headers);
    }
}
