package io.trading.analytics.gateway.core;

import io.trading.analytics.engine.AnalyticsEngine;
import io.trading.analytics.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single long-lived task moving ticks from the {@link TickChannel} into the engine.
 * It is the only thread that calls {@link AnalyticsEngine#onTrade}.
 */
public class IngestionWorker implements Runnable, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionWorker.class);
    private static final long POLL_TIMEOUT_MS = 100;

    private final TickChannel channel;
    private final AnalyticsEngine engine;
    private final AtomicLong processed = new AtomicLong();

    private volatile boolean running;
    private Thread thread;

    public IngestionWorker(TickChannel channel, AnalyticsEngine engine) {
        this.channel = channel;
        this.engine = engine;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this, "ingestion-worker");
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Ingestion worker started");
    }

    @Override
    public void run() {
        while (running) {
            TradeEvent event;
            try {
                event = channel.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            while (event != null) {
                ingest(event);
                event = channel.poll();
            }
        }
        LOGGER.info("Ingestion worker stopped after {} ticks", processed.get());
    }

    private void ingest(TradeEvent event) {
        try {
            engine.onTrade(event);
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to ingest {}", event, e);
        }
    }

    public long processed() {
        return processed.get();
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        Thread current;
        synchronized (this) {
            running = false;
            current = thread;
            thread = null;
        }
        if (current != null) {
            current.interrupt();
            try {
                current.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
