package io.trading.analytics.history;

import io.trading.analytics.model.AggregatedWindow;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded rolling sequences for one instrument: price, volume, timestamp and return.
 *
 * All four sequences share one capacity and evict oldest-first. The returns sequence
 * holds one entry per consecutive price pair whose earlier price is non-zero.
 * Appends and snapshots are mutually exclusive, so a reader sees a history either
 * before or after an append, never in between.
 */
final class InstrumentHistory {

    private final String instrumentId;
    private final DoubleRingBuffer prices;
    private final DoubleRingBuffer volumes;
    private final LongRingBuffer timestamps;
    private final DoubleRingBuffer returns;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long generation;

    InstrumentHistory(String instrumentId, int capacity) {
        this.instrumentId = instrumentId;
        this.prices = new DoubleRingBuffer(capacity);
        this.volumes = new DoubleRingBuffer(capacity);
        this.timestamps = new LongRingBuffer(capacity);
        // one return per consecutive price pair
        this.returns = new DoubleRingBuffer(capacity - 1);
    }

    void append(AggregatedWindow window, long flushGeneration) {
        lock.writeLock().lock();
        try {
            double price = window.meanPrice();
            if (!prices.isEmpty()) {
                double previous = prices.last();
                // a zero prior price has no defined return
                if (previous != 0.0) {
                    returns.add((price - previous) / previous);
                }
            }
            prices.add(price);
            volumes.add(window.totalVolume());
            timestamps.add(window.timestamp());
            generation = flushGeneration;
        } finally {
            lock.writeLock().unlock();
        }
    }

    HistorySnapshot snapshot(int limit) {
        lock.readLock().lock();
        try {
            return new HistorySnapshot(
                instrumentId,
                generation,
                prices.toArray(limit),
                volumes.toArray(limit),
                timestamps.toArray(limit),
                returns.toArray(limit)
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    double[] prices(int limit) {
        lock.readLock().lock();
        try {
            return prices.toArray(limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return prices.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
