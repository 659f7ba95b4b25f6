package io.trading.analytics.aggregation;

import io.trading.analytics.indicator.Indicators;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.TradeEvent;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers trade events per instrument and turns each buffer into one
 * {@link AggregatedWindow} per flush.
 *
 * <p>The buffer swap and the flush clock reset happen under the same lock, so a trade is
 * either in the window being emitted or in the next one, never in both and never lost.
 */
public class WindowAggregator {

    public static final long DEFAULT_FLUSH_INTERVAL_MS = 5000;

    private final EpochClock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private Map<String, TradeBuffer> buffers = new LinkedHashMap<>();
    private long lastFlushTime;

    public WindowAggregator() {
        this(SystemEpochClock.INSTANCE);
    }

    public WindowAggregator(EpochClock clock) {
        this.clock = clock;
        this.lastFlushTime = clock.time();
    }

    public void add(TradeEvent event) {
        lock.lock();
        try {
            buffers.computeIfAbsent(event.instrumentId(), id -> new TradeBuffer()).add(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true once at least {@code intervalMs} have elapsed since the last flush
     */
    public boolean shouldFlush(long intervalMs) {
        lock.lock();
        try {
            return clock.time() - lastFlushTime >= intervalMs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emits one window for every instrument that traded since the last flush, in first
     * seen order, then starts a new interval.
     */
    public List<AggregatedWindow> flush() {
        Map<String, TradeBuffer> drained;
        long now;
        lock.lock();
        try {
            now = clock.time();
            drained = buffers;
            buffers = new LinkedHashMap<>();
            lastFlushTime = now;
        } finally {
            lock.unlock();
        }

        List<AggregatedWindow> windows = new ArrayList<>(drained.size());
        for (Map.Entry<String, TradeBuffer> entry : drained.entrySet()) {
            TradeBuffer buffer = entry.getValue();
            if (buffer.size() > 0) {
                windows.add(buffer.toWindow(entry.getKey(), now));
            }
        }
        return windows;
    }

    public int pendingTrades() {
        lock.lock();
        try {
            int total = 0;
            for (TradeBuffer buffer : buffers.values()) {
                total += buffer.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public long getLastFlushTime() {
        lock.lock();
        try {
            return lastFlushTime;
        } finally {
            lock.unlock();
        }
    }

    private static final class TradeBuffer {
        private double[] prices = new double[16];
        private double[] quantities = new double[16];
        private int size;

        void add(TradeEvent event) {
            if (size == prices.length) {
                prices = Arrays.copyOf(prices, size * 2);
                quantities = Arrays.copyOf(quantities, size * 2);
            }
            prices[size] = event.price();
            quantities[size] = event.quantity();
            size++;
        }

        int size() {
            return size;
        }

        AggregatedWindow toWindow(String instrumentId, long timestamp) {
            double[] p = Arrays.copyOf(prices, size);
            double[] q = Arrays.copyOf(quantities, size);

            double min = p[0];
            double max = p[0];
            double totalVolume = 0.0;
            for (int i = 0; i < size; i++) {
                min = Math.min(min, p[i]);
                max = Math.max(max, p[i]);
                totalVolume += q[i];
            }
            // summation rounding can land the mean just outside the observed range
            double mean = Math.max(min, Math.min(max, Indicators.mean(p)));

            return new AggregatedWindow(
                timestamp,
                instrumentId,
                mean,
                Indicators.std(p),
                min,
                max,
                totalVolume,
                size,
                Indicators.vwap(p, q)
            );
        }
    }
}
