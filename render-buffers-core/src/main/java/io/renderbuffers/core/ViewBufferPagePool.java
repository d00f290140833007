package io.renderbuffers.core;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool of {@link ViewBufferPage}s.
 *
 * <p>Safe for use from many request threads at once. At most {@code maxRetainedPages} free pages
 * are kept; pages released beyond that are left to the garbage collector.
 */
public final class ViewBufferPagePool {
    private final int pageSize;
    private final int maxRetainedPages;
    private final ConcurrentLinkedQueue<ViewBufferPage> free = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retained = new AtomicInteger();

    public ViewBufferPagePool(int pageSize, int maxRetainedPages) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0: " + pageSize);
        }
        if (maxRetainedPages < 0) {
            throw new IllegalArgumentException("maxRetainedPages must be >= 0: " + maxRetainedPages);
        }
        this.pageSize = pageSize;
        this.maxRetainedPages = maxRetainedPages;
    }

    /**
     * A pool that never retains pages.
     */
    public static ViewBufferPagePool unpooled(int pageSize) {
        return new ViewBufferPagePool(pageSize, 0);
    }

    public int pageSize() {
        return pageSize;
    }

    public int maxRetainedPages() {
        return maxRetainedPages;
    }

    /**
     * Number of free pages currently held.
     */
    public int retained() {
        return retained.get();
    }

    public ViewBufferPage rent() {
        ViewBufferPage page = free.poll();
        if (page != null) {
            retained.decrementAndGet();
            return page;
        }
        return new ViewBufferPage(pageSize);
    }

    public void release(ViewBufferPage page) {
        if (page == null || page.capacity() != pageSize) return;
        page.reset();
        while (true) {
            int current = retained.get();
            if (current >= maxRetainedPages) return;
            if (retained.compareAndSet(current, current + 1)) {
                free.offer(page);
                return;
            }
        }
    }
}
