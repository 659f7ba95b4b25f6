package io.trading.analytics.indicator;

import io.trading.analytics.history.HistorySnapshot;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.Trend;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComputerTest {

    private final MetricsComputer computer = new MetricsComputer();

    @Test
    void testRisingSeries() {
        double[] prices = new double[21];
        for (int i = 0; i < prices.length; i++) {
            prices[i] = 100 + i;
        }

        MetricsSnapshot snapshot = computer.compute(history("X", 1, prices), Optional.empty(), 1000L);

        assertEquals("X", snapshot.instrumentId());
        assertEquals(1000L, snapshot.timestamp());
        assertEquals(110.0, snapshot.meanPrice(), 1e-9);
        assertEquals(110.5, snapshot.sma20(), 1e-9);
        assertTrue(snapshot.rsi14() > 50);
        assertEquals(100.0, snapshot.rsi14());
        assertTrue(snapshot.zScore() > 0);
        assertTrue(snapshot.adfPValue().isPresent());
        assertTrue(snapshot.garchForecast().isPresent());
        assertTrue(snapshot.correlation().isEmpty());
    }

    @Test
    void testUptrendAfterBreakout() {
        // long flat base, a step up, then a further rise
        double[] prices = new double[51];
        for (int i = 0; i < 30; i++) {
            prices[i] = 100;
        }
        for (int i = 30; i < 50; i++) {
            prices[i] = 110;
        }
        prices[50] = 111;

        MetricsSnapshot snapshot = computer.compute(history("X", 1, prices), Optional.empty(), 1L);

        assertTrue(snapshot.sma20() > snapshot.ema20());
        assertEquals(Trend.UPTREND, snapshot.trend());
    }

    @Test
    void testShortHistoryFallbacks() {
        MetricsSnapshot snapshot = computer.compute(history("X", 1, new double[]{100}), Optional.empty(), 1L);

        assertEquals(100.0, snapshot.meanPrice());
        assertEquals(0.0, snapshot.stdPrice());
        assertEquals(0.0, snapshot.volatility());
        assertEquals(0.0, snapshot.zScore());
        assertEquals(100.0, snapshot.sma20());
        assertEquals(100.0, snapshot.ema20());
        assertEquals(50.0, snapshot.rsi14());
        assertEquals(Trend.NEUTRAL, snapshot.trend());
        assertTrue(snapshot.adfPValue().isEmpty());
        assertTrue(snapshot.garchForecast().isEmpty());
    }

    @Test
    void testVolatilityIsCoefficientOfVariation() {
        MetricsSnapshot snapshot = computer.compute(history("X", 1, new double[]{90, 110}), Optional.empty(), 1L);

        assertEquals(10.0, snapshot.stdPrice(), 1e-9);
        assertEquals(0.1, snapshot.volatility(), 1e-9);
    }

    @Test
    void testPeerCorrelationRequiresSameGeneration() {
        double[] a = {1, 2, 3, 4, 5};
        double[] b = {2, 4, 6, 8, 11};

        MetricsSnapshot same = computer.compute(history("A", 7, a), Optional.of(history("B", 7, b)), 1L);
        assertTrue(same.correlation().isPresent());
        assertTrue(same.correlation().getAsDouble() > 0.95);

        MetricsSnapshot stale = computer.compute(history("A", 7, a), Optional.of(history("B", 6, b)), 1L);
        assertTrue(stale.correlation().isEmpty());

        MetricsSnapshot shorter = computer.compute(history("A", 7, a), Optional.of(history("B", 7, new double[]{1, 2})), 1L);
        assertTrue(shorter.correlation().isEmpty());
    }

    @Test
    void testAnomalies() {
        double[] prices = new double[20];
        for (int i = 0; i < prices.length; i++) {
            prices[i] = 100;
        }
        prices[19] = 200;

        double[] anomalies = computer.anomalies(prices, 3.0);
        assertArrayEquals(new double[]{200}, anomalies);

        assertEquals(0, computer.anomalies(new double[]{1, 2, 300}, 1.0).length);
    }

    static HistorySnapshot history(String instrumentId, long generation, double[] prices) {
        double[] returns = new double[Math.max(prices.length - 1, 0)];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        return new HistorySnapshot(instrumentId, generation, prices, new double[prices.length],
            new long[prices.length], returns);
    }
}
