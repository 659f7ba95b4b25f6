package io.trading.analytics.history;

import io.trading.analytics.model.AggregatedWindow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the rolling history of every tracked instrument.
 *
 * Each instrument keeps at most {@code capacity} points per sequence. Every batch of
 * appends is stamped with a flush generation so that two snapshots can be checked for
 * coming from the same flush before they are compared with each other.
 *
 * Instruments are listed in the order they were first seen.
 */
public class HistoryStore {

    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final Map<String, InstrumentHistory> histories = new ConcurrentHashMap<>();
    private final List<String> instrumentOrder = new CopyOnWriteArrayList<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong publishedGeneration = new AtomicLong();

    public HistoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryStore(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be at least 2");
        }
        this.capacity = capacity;
    }

    /**
     * Appends a single window in its own flush generation.
     */
    public void append(AggregatedWindow window) {
        appendAll(List.of(window));
    }

    /**
     * Appends the windows of one flush, all stamped with the same new generation.
     *
     * @return the generation assigned to this batch
     */
    public long appendAll(Collection<AggregatedWindow> windows) {
        long flushGeneration = generation.incrementAndGet();
        try {
            for (AggregatedWindow window : windows) {
                historyFor(window.instrumentId()).append(window, flushGeneration);
            }
        } finally {
            publishedGeneration.set(flushGeneration);
        }
        return flushGeneration;
    }

    /**
     * Gets up to {@code limit} of the most recent prices, oldest first.
     * Unknown instruments yield an empty array.
     */
    public double[] recentPrices(String instrumentId, int limit) {
        InstrumentHistory history = histories.get(instrumentId);
        return history == null ? new double[0] : history.prices(limit);
    }

    /**
     * Takes a consistent copy of the full history of one instrument.
     */
    public Optional<HistorySnapshot> snapshot(String instrumentId) {
        InstrumentHistory history = histories.get(instrumentId);
        return history == null ? Optional.empty() : Optional.of(history.snapshot(capacity));
    }

    /**
     * Takes copies of every instrument, in first-seen order, that all reflect the same
     * completed flush batch. A read that overlaps a batch is retried rather than blocking
     * the writer.
     */
    public List<HistorySnapshot> snapshotAll() {
        while (true) {
            long before = publishedGeneration.get();
            if (generation.get() != before) {
                // batch in progress
                Thread.onSpinWait();
                continue;
            }
            List<HistorySnapshot> result = new ArrayList<>(instrumentOrder.size());
            for (String instrumentId : instrumentOrder) {
                InstrumentHistory history = histories.get(instrumentId);
                if (history != null) {
                    result.add(history.snapshot(capacity));
                }
            }
            if (generation.get() == before) {
                return result;
            }
        }
    }

    public int size(String instrumentId) {
        InstrumentHistory history = histories.get(instrumentId);
        return history == null ? 0 : history.size();
    }

    public List<String> instruments() {
        return List.copyOf(instrumentOrder);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Gets the generation of the most recent flush batch.
     */
    public long currentGeneration() {
        return generation.get();
    }

    private InstrumentHistory historyFor(String instrumentId) {
        return histories.computeIfAbsent(instrumentId, id -> {
            instrumentOrder.add(id);
            return new InstrumentHistory(id, capacity);
        });
    }
}
