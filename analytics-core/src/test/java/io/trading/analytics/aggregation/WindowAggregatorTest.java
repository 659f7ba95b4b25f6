package io.trading.analytics.aggregation;

import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.TradeEvent;
import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowAggregatorTest {

    private CachedEpochClock clock;
    private WindowAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new CachedEpochClock();
        clock.update(1_000L);
        aggregator = new WindowAggregator(clock);
    }

    @Test
    void testAggregatesOneInterval() {
        aggregator.add(new TradeEvent(1_001L, "X", 100.0, 1.0));
        aggregator.add(new TradeEvent(1_002L, "X", 101.0, 2.0));
        aggregator.add(new TradeEvent(1_003L, "X", 99.0, 1.0));
        clock.update(6_000L);

        List<AggregatedWindow> windows = aggregator.flush();

        assertEquals(1, windows.size());
        AggregatedWindow window = windows.get(0);
        assertEquals("X", window.instrumentId());
        assertEquals(6_000L, window.timestamp());
        assertEquals(100.0, window.meanPrice(), 1e-9);
        assertEquals(Math.sqrt(2.0 / 3.0), window.stdPrice(), 1e-9);
        assertEquals(99.0, window.minPrice());
        assertEquals(101.0, window.maxPrice());
        assertEquals(4.0, window.totalVolume(), 1e-9);
        assertEquals(3, window.tradeCount());
        assertEquals(100.25, window.vwap(), 1e-9);
    }

    @Test
    void testMeanStaysWithinRangeForInexactPrices() {
        // 0.1 + 0.1 + 0.1 divided by 3 rounds above 0.1
        for (int i = 0; i < 3; i++) {
            aggregator.add(new TradeEvent(1_001L + i, "X", 0.1, 1.0));
        }
        clock.update(6_000L);

        AggregatedWindow window = aggregator.flush().get(0);

        assertEquals(0.1, window.minPrice());
        assertEquals(0.1, window.maxPrice());
        assertTrue(window.meanPrice() >= window.minPrice());
        assertTrue(window.meanPrice() <= window.maxPrice());
        assertEquals(0.1, window.meanPrice());
    }

    @Test
    void testWindowRejectsMeanOutsideRange() {
        assertThrows(IllegalArgumentException.class,
            () -> new AggregatedWindow(1L, "X", 102.0, 0.0, 99.0, 101.0, 1.0, 1, 100.0));
        assertThrows(IllegalArgumentException.class,
            () -> new AggregatedWindow(1L, "X", 98.0, 0.0, 99.0, 101.0, 1.0, 1, 100.0));
    }

    @Test
    void testShouldFlushIsTimeBased() {
        assertFalse(aggregator.shouldFlush(5_000L));

        clock.update(5_999L);
        assertFalse(aggregator.shouldFlush(5_000L));

        clock.update(6_000L);
        assertTrue(aggregator.shouldFlush(5_000L));

        aggregator.flush();
        assertFalse(aggregator.shouldFlush(5_000L));
        assertEquals(6_000L, aggregator.getLastFlushTime());
    }

    @Test
    void testEachTradeEmittedExactlyOnce() {
        aggregator.add(new TradeEvent(1L, "A", 10.0, 1.0));
        aggregator.add(new TradeEvent(1L, "B", 20.0, 1.0));

        List<AggregatedWindow> first = aggregator.flush();
        assertEquals(2, first.size());
        assertEquals("A", first.get(0).instrumentId());
        assertEquals("B", first.get(1).instrumentId());

        aggregator.add(new TradeEvent(2L, "A", 11.0, 1.0));
        List<AggregatedWindow> second = aggregator.flush();

        // B was idle and gets no zero-filled window
        assertEquals(1, second.size());
        assertEquals("A", second.get(0).instrumentId());
        assertEquals(1, second.get(0).tradeCount());

        assertTrue(aggregator.flush().isEmpty());
    }

    @Test
    void testZeroVolumeWindow() {
        aggregator.add(new TradeEvent(1L, "X", 10.0, 0.0));
        aggregator.add(new TradeEvent(1L, "X", 12.0, 0.0));

        AggregatedWindow window = aggregator.flush().get(0);

        assertEquals(0.0, window.totalVolume());
        assertEquals(0.0, window.vwap());
        assertEquals(11.0, window.meanPrice(), 1e-9);
    }

    @Test
    void testBufferGrowsPastInitialSize() {
        for (int i = 0; i < 100; i++) {
            aggregator.add(new TradeEvent(i, "X", 100.0 + i, 1.0));
        }
        assertEquals(100, aggregator.pendingTrades());

        AggregatedWindow window = aggregator.flush().get(0);

        assertEquals(100, window.tradeCount());
        assertEquals(100.0, window.minPrice());
        assertEquals(199.0, window.maxPrice());
        assertEquals(0, aggregator.pendingTrades());
    }
}
