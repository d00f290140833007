package io.renderbuffers.core;

import java.util.Objects;

/**
 * Configuration shared by the buffers and writers of one application.
 *
 * <p>Use {@link #builder()} to override defaults:
 * <pre>{@code
 * ViewBufferOptions options = ViewBufferOptions.builder()
 *     .pageSize(64)
 *     .maxRetainedPages(256)
 *     .newLine("\n")
 *     .build();
 * }</pre>
 */
public final class ViewBufferOptions {

    public static final int DEFAULT_PAGE_SIZE = 32;

    public static final int DEFAULT_MAX_RETAINED_PAGES = 64;

    public static final String DEFAULT_NEW_LINE = "\r\n";

    private static final ViewBufferOptions DEFAULTS = builder().build();

    private final int pageSize;
    private final int maxRetainedPages;
    private final String newLine;
    private final HtmlEncoder encoder;

    private ViewBufferOptions(Builder builder) {
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : DEFAULT_PAGE_SIZE;
        this.maxRetainedPages = builder.maxRetainedPages >= 0 ? builder.maxRetainedPages : DEFAULT_MAX_RETAINED_PAGES;
        this.newLine = builder.newLine != null ? builder.newLine : DEFAULT_NEW_LINE;
        this.encoder = builder.encoder != null ? builder.encoder : HtmlEncoder.DEFAULT;
    }

    public static ViewBufferOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int pageSize() {
        return pageSize;
    }

    public int maxRetainedPages() {
        return maxRetainedPages;
    }

    public String newLine() {
        return newLine;
    }

    public HtmlEncoder encoder() {
        return encoder;
    }

    /**
     * Creates a page pool sized by these options.
     */
    public ViewBufferPagePool newPagePool() {
        return new ViewBufferPagePool(pageSize, maxRetainedPages);
    }

    @Override
    public String toString() {
        return "ViewBufferOptions{pageSize=" + pageSize
                + ", maxRetainedPages=" + maxRetainedPages
                + ", newLine=" + newLine.replace("\r", "\\r").replace("\n", "\\n")
                + ", encoder=" + encoder.getClass().getSimpleName() + "}";
    }

    /**
     * Builder for {@link ViewBufferOptions}.
     */
    public static final class Builder {
        private int pageSize;
        private int maxRetainedPages = -1;
        private String newLine;
        private HtmlEncoder encoder;

        private Builder() {
        }

        /** Sets the number of values held per buffer page. Default: 32. */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /** Sets how many free pages the pool keeps. Default: 64. */
        public Builder maxRetainedPages(int maxRetainedPages) {
            this.maxRetainedPages = maxRetainedPages;
            return this;
        }

        /** Sets the line terminator used by {@code writeLine}. Default: CRLF. */
        public Builder newLine(String newLine) {
            this.newLine = Objects.requireNonNull(newLine, "newLine");
            return this;
        }

        /** Sets the encoding policy for unencoded text. Default: {@link HtmlEncoder#DEFAULT}. */
        public Builder encoder(HtmlEncoder encoder) {
            this.encoder = Objects.requireNonNull(encoder, "encoder");
            return this;
        }

        public ViewBufferOptions build() {
            return new ViewBufferOptions(this);
        }
    }
}
