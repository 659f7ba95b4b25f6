package io.trading.analytics.gateway.core;

import io.trading.analytics.gateway.feed.FeedState;
import io.trading.analytics.gateway.feed.FeedStatus;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically checks the registered feeds and logs disconnections and stale ticks.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final long staleAfterMs;
    private final EpochClock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, FeedHealth> feeds = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    /**
     * @param checkIntervalMs Interval between checks
     * @param staleAfterMs    Age of the newest tick after which a connected feed is reported stale
     * @param clock           Wall clock the tick timestamps are compared against
     */
    public HealthMonitor(long checkIntervalMs, long staleAfterMs, EpochClock clock) {
        if (checkIntervalMs <= 0 || staleAfterMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs and staleAfterMs must be positive");
        }
        this.checkIntervalMs = checkIntervalMs;
        this.staleAfterMs = staleAfterMs;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void registerFeed(String name, Supplier<FeedStatus> statusSupplier) {
        feeds.put(name, new FeedHealth(name, statusSupplier));
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler.scheduleAtFixedRate(this::runCheck, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Health monitor started (interval: {} ms, stale after: {} ms)", checkIntervalMs, staleAfterMs);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    private void runCheck() {
        try {
            performHealthCheck();
        } catch (RuntimeException e) {
            LOGGER.error("Health check failed", e);
        }
    }

    void performHealthCheck() {
        long now = clock.time();
        for (FeedHealth feed : feeds.values()) {
            FeedStatus status = feed.statusSupplier.get();
            feed.update(status, now, staleAfterMs);

            if (status.status() == FeedState.FAILED) {
                LOGGER.error("[HealthMonitor] {} has failed and will not reconnect", feed.name);
            } else if (status.status() != FeedState.CONNECTED) {
                LOGGER.warn("[HealthMonitor] {} is {}", feed.name, status.status());
            } else if (feed.stale) {
                LOGGER.warn("[HealthMonitor] {} is connected but no tick for {} ms",
                    feed.name, now - status.lastTickTimestamp());
            }
        }
    }

    /**
     * A gateway is healthy unless one of its feeds has given up reconnecting.
     */
    public boolean isHealthy() {
        for (FeedHealth feed : feeds.values()) {
            if (feed.statusSupplier.get().status() == FeedState.FAILED) {
                return false;
            }
        }
        return true;
    }

    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        for (FeedHealth feed : feeds.values()) {
            FeedStatus status = feed.statusSupplier.get();
            LOGGER.info("{}: state={}, ticks={}, parseErrors={}, reconnects={}, disconnectChecks={}",
                feed.name, status.status(), status.ticksReceived(), status.parseErrors(),
                status.reconnectAttempts(), feed.disconnectCount);
        }
        LOGGER.info("=============================");
    }

    public FeedHealth getFeedHealth(String name) {
        return feeds.get(name);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check results of one feed.
     */
    public static final class FeedHealth {
        private final String name;
        private final Supplier<FeedStatus> statusSupplier;
        private volatile long disconnectCount = 0;
        private volatile long lastDisconnectTime = 0;
        private volatile boolean stale = false;

        FeedHealth(String name, Supplier<FeedStatus> statusSupplier) {
            this.name = name;
            this.statusSupplier = statusSupplier;
        }

        private void update(FeedStatus status, long now, long staleAfterMs) {
            if (status.status() != FeedState.CONNECTED) {
                disconnectCount++;
                lastDisconnectTime = now;
                stale = false;
                return;
            }
            stale = status.lastTickTimestamp() > 0 && now - status.lastTickTimestamp() > staleAfterMs;
        }

        public String getName() {
            return name;
        }

        public long getDisconnectCount() {
            return disconnectCount;
        }

        public long getLastDisconnectTime() {
            return lastDisconnectTime;
        }

        public boolean isStale() {
            return stale;
        }
    }
}
