/**
 * Jakarta Servlet binding: streams a render into an {@link jakarta.servlet.http.HttpServletResponse}
 * through a {@link io.renderbuffers.core.ViewBufferTextWriter}.
 */
package io.renderbuffers.servlet;
