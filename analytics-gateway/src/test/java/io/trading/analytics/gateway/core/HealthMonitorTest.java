package io.trading.analytics.gateway.core;

import io.trading.analytics.gateway.feed.FeedState;
import io.trading.analytics.gateway.feed.FeedStatus;
import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    @Test
    void testDetectsStaleAndDisconnectedFeed() {
        CachedEpochClock clock = new CachedEpochClock();
        clock.update(100_000L);
        AtomicReference<FeedStatus> status = new AtomicReference<>(
            new FeedStatus(FeedState.CONNECTED, 10.0, 5, 99_000L, 0, 0));

        try (HealthMonitor monitor = new HealthMonitor(1_000, 30_000, clock)) {
            monitor.registerFeed("feed", status::get);

            monitor.performHealthCheck();
            HealthMonitor.FeedHealth health = monitor.getFeedHealth("feed");
            assertFalse(health.isStale());
            assertEquals(0, health.getDisconnectCount());

            clock.update(200_000L);
            monitor.performHealthCheck();
            assertTrue(health.isStale());

            status.set(new FeedStatus(FeedState.RECONNECTING, 0.0, 5, 99_000L, 0, 1));
            monitor.performHealthCheck();
            assertFalse(health.isStale());
            assertEquals(1, health.getDisconnectCount());
            assertEquals(200_000L, health.getLastDisconnectTime());
            assertTrue(monitor.isHealthy());

            status.set(new FeedStatus(FeedState.FAILED, 0.0, 5, 99_000L, 0, 10));
            assertFalse(monitor.isHealthy());
        }
    }
}
