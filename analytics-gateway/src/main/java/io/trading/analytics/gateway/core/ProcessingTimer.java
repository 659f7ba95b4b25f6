package io.trading.analytics.gateway.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency recorder for the gateway hot paths (message parsing, flush, publication).
 *
 * Statistics are grouped by component and operation, e.g. {@code feed/parse} or
 * {@code engine/flush}, and kept as count, total, min and max in atomics so any
 * thread may record without locking.
 */
public class ProcessingTimer {

    private static final long NANO_TO_MICRO = 1_000L;

    private final Map<TimerKey, TimerStats> statsMap = new ConcurrentHashMap<>();

    /**
     * Starts a measurement. The returned context is stopped by the caller.
     */
    public TimingContext start() {
        return new TimingContext(System.nanoTime());
    }

    /**
     * Records one measured duration.
     *
     * @param component    Recording component, e.g. {@code feed}
     * @param operation    Measured operation, e.g. {@code parse}
     * @param nanoDuration Duration in nanoseconds
     */
    public void record(String component, String operation, long nanoDuration) {
        statsMap.computeIfAbsent(new TimerKey(component, operation), k -> new TimerStats()).record(nanoDuration);
    }

    /**
     * Gets the statistics of one component and operation, or null when nothing was recorded.
     */
    public TimerStats getStats(String component, String operation) {
        return statsMap.get(new TimerKey(component, operation));
    }

    public Map<TimerKey, TimerStats> getAllStats() {
        return statsMap;
    }

    public static final class TimingContext {
        private final long startTime;

        TimingContext(long startTime) {
            this.startTime = startTime;
        }

        /**
         * Returns the elapsed time in nanoseconds.
         */
        public long stop() {
            return System.nanoTime() - startTime;
        }
    }

    public record TimerKey(String component, String operation) {
        public TimerKey {
            if (component == null || component.isEmpty()) {
                throw new IllegalArgumentException("component cannot be null or empty");
            }
            if (operation == null || operation.isEmpty()) {
                throw new IllegalArgumentException("operation cannot be null or empty");
            }
        }

        @Override
        public String toString() {
            return component + "/" + operation;
        }
    }

    public static final class TimerStats {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong();

        void record(long nanos) {
            count.incrementAndGet();
            totalNanos.addAndGet(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public long getCount() {
            return count.get();
        }

        public double getAvgMicros() {
            long c = count.get();
            return c > 0 ? (double) totalNanos.get() / c / NANO_TO_MICRO : 0.0;
        }

        public long getMinMicros() {
            long m = minNanos.get();
            return m == Long.MAX_VALUE ? 0 : m / NANO_TO_MICRO;
        }

        public long getMaxMicros() {
            return maxNanos.get() / NANO_TO_MICRO;
        }

        public long getTotalNanos() {
            return totalNanos.get();
        }
    }
}
