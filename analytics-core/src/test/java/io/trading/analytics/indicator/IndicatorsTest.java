package io.trading.analytics.indicator;

import io.trading.analytics.model.Trend;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorsTest {

    private static final double EPS = 1e-9;

    @Test
    void testMeanAndStd() {
        assertEquals(0.0, Indicators.mean(new double[0]));
        assertEquals(5.0, Indicators.mean(new double[]{2, 4, 4, 4, 5, 5, 7, 9}), EPS);

        // population deviation, divide by N
        assertEquals(2.0, Indicators.std(new double[]{2, 4, 4, 4, 5, 5, 7, 9}), EPS);
        assertEquals(0.0, Indicators.std(new double[]{42}));
        assertEquals(0.0, Indicators.std(new double[0]));
    }

    @Test
    void testVwap() {
        assertEquals(0.0, Indicators.vwap(new double[]{100, 101}, new double[]{0, 0}));
        assertEquals(0.0, Indicators.vwap(new double[]{100, 101}, new double[]{1}));
        assertEquals(0.0, Indicators.vwap(new double[0], new double[0]));

        double[] prices = {100, 102, 107};
        assertEquals(Indicators.mean(prices), Indicators.vwap(prices, new double[]{3, 3, 3}), EPS);
        assertEquals(100.25, Indicators.vwap(new double[]{100, 101, 99}, new double[]{1, 2, 1}), EPS);
    }

    @Test
    void testSma() {
        assertEquals(4.5, Indicators.sma(new double[]{1, 2, 3, 4, 5}, 2), EPS);
        // fewer points than the period falls back to the mean of all
        assertEquals(3.0, Indicators.sma(new double[]{1, 2, 3, 4, 5}, 20), EPS);
        assertEquals(0.0, Indicators.sma(new double[0], 20));
    }

    @Test
    void testEma() {
        assertEquals(7.0, Indicators.ema(new double[]{7}, 1), EPS);
        assertEquals(7.0, Indicators.ema(new double[]{7}, 20), EPS);
        assertEquals(3.5, Indicators.ema(new double[]{3.5, 3.5, 3.5, 3.5, 3.5}, 3), EPS);
        assertEquals(2.0, Indicators.ema(new double[]{1, 2, 3}, 5), EPS);
        // k = 0.5: 1 -> 1.5 -> 2.25
        assertEquals(2.25, Indicators.ema(new double[]{1, 2, 3}, 3), EPS);
        assertEquals(0.0, Indicators.ema(new double[0], 3));
    }

    @Test
    void testRsi() {
        assertEquals(50.0, Indicators.rsi(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14}, 14));

        double[] rising = new double[15];
        double[] flat = new double[15];
        double[] alternating = new double[15];
        for (int i = 0; i < 15; i++) {
            rising[i] = 100 + i;
            flat[i] = 100;
            alternating[i] = i % 2 == 0 ? 100 : 101;
        }
        assertEquals(100.0, Indicators.rsi(rising, 14));
        assertEquals(50.0, Indicators.rsi(flat, 14));
        assertEquals(50.0, Indicators.rsi(alternating, 14), EPS);

        double[] falling = new double[15];
        for (int i = 0; i < 15; i++) {
            falling[i] = 100 - i;
        }
        assertEquals(0.0, Indicators.rsi(falling, 14), EPS);
    }

    @Test
    void testZScore() {
        assertEquals(0.0, Indicators.zScore(1234.5, 10.0, 0.0));
        assertEquals(2.0, Indicators.zScore(14.0, 10.0, 2.0), EPS);
        assertEquals(-1.5, Indicators.zScore(7.0, 10.0, 2.0), EPS);
    }

    @Test
    void testCorrelation() {
        double[] a = {1, 2, 3, 4, 5};
        double[] b = {2, 4, 6, 8, 10};
        double[] c = {5, 4, 3, 2, 1};
        double[] noisy = {1.3, 2.9, 2.1, 4.8, 4.1};

        assertEquals(1.0, Indicators.correlation(a, b).getAsDouble(), EPS);
        assertEquals(-1.0, Indicators.correlation(a, c).getAsDouble(), EPS);
        assertEquals(Indicators.correlation(a, noisy).getAsDouble(),
            Indicators.correlation(noisy, a).getAsDouble(), EPS);

        assertTrue(Indicators.correlation(a, new double[]{1, 2, 3}).isEmpty());
        assertTrue(Indicators.correlation(new double[]{1}, new double[]{1}).isEmpty());
        assertTrue(Indicators.correlation(a, new double[]{3, 3, 3, 3, 3}).isEmpty());
    }

    @Test
    void testTrend() {
        assertEquals(Trend.UPTREND, Indicators.trend(105, 100, 110));
        assertEquals(Trend.DOWNTREND, Indicators.trend(95, 100, 90));
        assertEquals(Trend.NEUTRAL, Indicators.trend(100, 105, 110));
        assertEquals(Trend.NEUTRAL, Indicators.trend(100, 100, 100));
    }

    @Test
    void testStationarityPValue() {
        assertTrue(Indicators.stationarityPValue(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9}, 10).isEmpty());

        double[] constant = {5, 5, 5, 5, 5, 5, 5, 5, 5, 5};
        assertEquals(1.0, Indicators.stationarityPValue(constant, 10).getAsDouble());

        double[] alternating = {1, -1, 1, -1, 1, -1, 1, -1, 1, -1};
        // autocovariance -9/10 over variance 1
        assertEquals(1.0 / 1.9, Indicators.stationarityPValue(alternating, 10).getAsDouble(), EPS);
    }

    @Test
    void testVolatilityForecast() {
        assertTrue(Indicators.volatilityForecast(new double[9], 0.1, 0.85, 10).isEmpty());

        double[] constantReturns = new double[10];
        Arrays.fill(constantReturns, 0.01);
        OptionalDouble forecast = Indicators.volatilityForecast(constantReturns, 0.1, 0.85, 10);
        // zero variance leaves only the alpha * last^2 term
        assertEquals(Math.sqrt(0.1 * 0.01 * 0.01), forecast.getAsDouble(), 1e-12);

        double[] returns = {0.01, -0.02, 0.015, -0.005, 0.0, 0.02, -0.01, 0.005, -0.015, 0.01};
        double variance = Indicators.variance(returns);
        double expected = Math.sqrt(0.05 * variance + 0.1 * 0.01 * 0.01 + 0.85 * variance);
        assertEquals(expected, Indicators.volatilityForecast(returns, 0.1, 0.85, 10).getAsDouble(), 1e-12);
    }

    @Test
    void testTail() {
        assertArrayEquals(new double[]{4, 5}, Indicators.tail(new double[]{1, 2, 3, 4, 5}, 2));
        assertArrayEquals(new double[]{1, 2}, Indicators.tail(new double[]{1, 2}, 5));
    }
}
