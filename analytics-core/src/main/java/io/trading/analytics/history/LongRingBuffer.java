package io.trading.analytics.history;

/**
 * Fixed-capacity ring of longs, used for timestamps.
 * Same eviction semantics as {@link DoubleRingBuffer}.
 */
public final class LongRingBuffer {

    private final long[] values;
    private int head;
    private int size;

    public LongRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.values = new long[capacity];
    }

    public void add(long value) {
        values[(head + size) % values.length] = value;
        if (size < values.length) {
            size++;
        } else {
            head = (head + 1) % values.length;
        }
    }

    public int size() {
        return size;
    }

    /**
     * Copies the newest {@code limit} values, oldest first.
     */
    public long[] toArray(int limit) {
        int count = Math.min(Math.max(limit, 0), size);
        long[] result = new long[count];
        int start = size - count;
        for (int i = 0; i < count; i++) {
            result[i] = values[(head + start + i) % values.length];
        }
        return result;
    }

    public long[] toArray() {
        return toArray(size);
    }
}
