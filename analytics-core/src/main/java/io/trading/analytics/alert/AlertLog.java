package io.trading.analytics.alert;

import io.trading.analytics.model.AlertEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded trailing log of alert events; the oldest event is dropped first.
 */
public class AlertLog {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final ArrayDeque<AlertEvent> events;

    public AlertLog() {
        this(DEFAULT_CAPACITY);
    }

    public AlertLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void append(AlertEvent event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    /**
     * Gets up to {@code limit} most recent events, oldest first.
     */
    public synchronized List<AlertEvent> recent(int limit) {
        int count = Math.min(Math.max(limit, 0), events.size());
        List<AlertEvent> result = new ArrayList<>(count);
        Iterator<AlertEvent> newestFirst = events.descendingIterator();
        for (int i = 0; i < count; i++) {
            result.add(newestFirst.next());
        }
        Collections.reverse(result);
        return result;
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
