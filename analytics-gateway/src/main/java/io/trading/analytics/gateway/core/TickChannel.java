package io.trading.analytics.gateway.core;

import io.trading.analytics.model.TradeEvent;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the feed thread and the ingestion worker.
 *
 * <p>{@link #offer} never blocks: when the queue is full the oldest tick is discarded
 * to make room and counted as dropped.
 */
public class TickChannel {

    public static final int DEFAULT_CAPACITY = 65_536;

    private final ArrayBlockingQueue<TradeEvent> queue;
    private final int capacity;
    private final Runnable onDrop;
    private final AtomicLong dropped = new AtomicLong();

    public TickChannel() {
        this(DEFAULT_CAPACITY, () -> { });
    }

    /**
     * @param capacity Maximum number of queued ticks
     * @param onDrop   Called once per discarded tick
     */
    public TickChannel(int capacity, Runnable onDrop) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (onDrop == null) {
            throw new IllegalArgumentException("onDrop cannot be null");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onDrop = onDrop;
    }

    public void offer(TradeEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
                onDrop.run();
            }
        }
    }

    /**
     * Waits up to the timeout for the next tick.
     *
     * @return the tick, or null on timeout
     */
    public TradeEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public TradeEvent poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long dropped() {
        return dropped.get();
    }
}
