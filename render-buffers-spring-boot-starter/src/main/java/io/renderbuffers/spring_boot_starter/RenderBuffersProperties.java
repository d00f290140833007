package io.renderbuffers.spring_boot_starter;

import io.renderbuffers.core.ViewBufferOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Properties bound from {@code render-buffers.*}.
 */
@ConfigurationProperties(prefix = "render-buffers")
public class RenderBuffersProperties {

    /**
     * Number of buffered values per page.
     */
    private int pageSize = ViewBufferOptions.DEFAULT_PAGE_SIZE;

    /**
     * Free pages kept by the shared pool.
     */
    private int maxRetainedPages = ViewBufferOptions.DEFAULT_MAX_RETAINED_PAGES;

    /**
     * Line terminator used by writeLine.
     */
    private String newLine = ViewBufferOptions.DEFAULT_NEW_LINE;

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxRetainedPages() {
        return maxRetainedPages;
    }

    public void setMaxRetainedPages(int maxRetainedPages) {
        this.maxRetainedPages = maxRetainedPages;
    }

    public String getNewLine() {
        return newLine;
    }

    public void setNewLine(String newLine) {
        this.newLine = newLine;
    }

    ViewBufferOptions toOptions() {
        return ViewBufferOptions.builder()
                .pageSize(pageSize)
                .maxRetainedPages(maxRetainedPages)
                .newLine(newLine)
                .build();
    }
}
