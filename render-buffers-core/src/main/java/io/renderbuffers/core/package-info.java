/**
 * Buffered text output for streaming server-side rendering.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.renderbuffers.core.TextChunk} (a single unit of pending output)</li>
 *   <li>{@link io.renderbuffers.core.ViewBuffer} (paged, append-only chunk buffer)</li>
 *   <li>{@link io.renderbuffers.core.ViewBufferTextWriter} (synchronous writer that drains the buffer on flush)</li>
 *   <li>{@link io.renderbuffers.core.HtmlEncoder} and the html content capabilities recognised by the writer</li>
 * </ul>
 *
 * <p>HTTP bindings live in other modules and only supply the terminal {@link java.io.Writer}
 * or {@link io.renderbuffers.core.AsyncTextSink} that buffered output is drained to.
 */
package io.renderbuffers.core;
