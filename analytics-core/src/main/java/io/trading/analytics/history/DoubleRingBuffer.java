package io.trading.analytics.history;

import java.util.Arrays;

/**
 * Fixed-capacity ring of doubles. Appending to a full ring overwrites the oldest value.
 * Not thread-safe; callers guard access.
 */
public final class DoubleRingBuffer {

    private final double[] values;
    private int head;
    private int size;

    public DoubleRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.values = new double[capacity];
    }

    public void add(double value) {
        values[(head + size) % values.length] = value;
        if (size < values.length) {
            size++;
        } else {
            head = (head + 1) % values.length;
        }
    }

    /**
     * Gets the i-th value counted from the oldest retained element.
     */
    public double get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of [0, " + size + ")");
        }
        return values[(head + index) % values.length];
    }

    /**
     * Gets the newest value.
     */
    public double last() {
        return get(size - 1);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Copies the newest {@code limit} values, oldest first.
     */
    public double[] toArray(int limit) {
        int count = Math.min(Math.max(limit, 0), size);
        double[] result = new double[count];
        int start = size - count;
        for (int i = 0; i < count; i++) {
            result[i] = values[(head + start + i) % values.length];
        }
        return result;
    }

    public double[] toArray() {
        return toArray(size);
    }

    @Override
    public String toString() {
        return "DoubleRingBuffer" + Arrays.toString(toArray());
    }
}
