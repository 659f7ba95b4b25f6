package io.trading.analytics.backtest;

/**
 * Mean-reversion backtest parameters.
 *
 * @param period         Trailing window length for the rolling z-score
 * @param entryThreshold Absolute z-score that opens a position
 * @param exitThreshold  Absolute z-score below which an open position is closed
 */
public record BacktestSettings(int period, double entryThreshold, double exitThreshold) {

    public static final BacktestSettings DEFAULTS = new BacktestSettings(20, 2.0, 0.0);

    public BacktestSettings {
        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2");
        }
        if (!Double.isFinite(entryThreshold) || entryThreshold < 0) {
            throw new IllegalArgumentException("entryThreshold must be finite and non-negative");
        }
        if (!Double.isFinite(exitThreshold) || exitThreshold < 0) {
            throw new IllegalArgumentException("exitThreshold must be finite and non-negative");
        }
    }
}
