package io.renderbuffers.core;

import java.util.Arrays;

/**
 * Fixed-capacity block of buffered values, rented from a {@link ViewBufferPagePool}.
 */
public final class ViewBufferPage {
    private final ViewBufferValue[] values;
    private int count;

    ViewBufferPage(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        }
        this.values = new ViewBufferValue[capacity];
    }

    public int capacity() {
        return values.length;
    }

    public int count() {
        return count;
    }

    public boolean isFull() {
        return count == values.length;
    }

    public ViewBufferValue get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("index " + index + " out of range [0, " + count + ")");
        }
        return values[index];
    }

    void append(ViewBufferValue value) {
        values[count++] = value;
    }

    void reset() {
        Arrays.fill(values, 0, count, null);
        count = 0;
    }
}
