package io.trading.analytics.model;

import java.util.OptionalDouble;

/**
 * Indicators computed for one instrument at one flush.
 *
 * @param timestamp     Timestamp of the window that produced the snapshot
 * @param instrumentId  Instrument symbol
 * @param meanPrice     Mean of the rolling price history
 * @param stdPrice      Population standard deviation of the rolling price history
 * @param volatility    Coefficient of variation (std / mean)
 * @param zScore        Z-score of the latest price against the recent window
 * @param sma20         Simple moving average
 * @param ema20         Exponential moving average
 * @param rsi14         Relative strength index
 * @param correlation   Correlation with the configured peer instrument, if comparable
 * @param garchForecast One step volatility forecast, if enough returns
 * @param adfPValue     Stationarity heuristic pseudo p-value, if enough prices
 * @param trend         Trend classification
 */
public record MetricsSnapshot(
    long timestamp,
    String instrumentId,
    double meanPrice,
    double stdPrice,
    double volatility,
    double zScore,
    double sma20,
    double ema20,
    double rsi14,
    OptionalDouble correlation,
    OptionalDouble garchForecast,
    OptionalDouble adfPValue,
    Trend trend
) {
    public MetricsSnapshot {
        if (instrumentId == null || instrumentId.isEmpty()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
        if (correlation == null || garchForecast == null || adfPValue == null) {
            throw new IllegalArgumentException("optional metrics cannot be null, use OptionalDouble.empty()");
        }
        if (trend == null) {
            throw new IllegalArgumentException("trend cannot be null");
        }
    }
}
