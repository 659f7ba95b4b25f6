package io.trading.analytics.indicator;

/**
 * Periods and coefficients used by {@link MetricsComputer}.
 *
 * @param smaPeriod                 Simple moving average lookback
 * @param emaPeriod                 Exponential moving average lookback
 * @param rsiPeriod                 RSI lookback in price changes
 * @param zScoreWindow              Number of recent prices the z-score is measured against
 * @param stationarityMinPoints     Minimum prices for the stationarity heuristic
 * @param garchAlpha                Weight of the last squared return
 * @param garchBeta                 Weight of the recent variance
 * @param volatilityMinReturns      Minimum returns for the volatility forecast
 * @param anomalyZThreshold         Absolute z-score above which a price counts as anomalous
 * @param anomalyMinPoints          Minimum prices for anomaly detection
 */
public record IndicatorSettings(
    int smaPeriod,
    int emaPeriod,
    int rsiPeriod,
    int zScoreWindow,
    int stationarityMinPoints,
    double garchAlpha,
    double garchBeta,
    int volatilityMinReturns,
    double anomalyZThreshold,
    int anomalyMinPoints
) {
    public static final IndicatorSettings DEFAULTS = new IndicatorSettings(
        20, 20, 14, 60, 10, 0.1, 0.85, 10, 3.0, 10
    );

    public IndicatorSettings {
        if (smaPeriod <= 0 || emaPeriod <= 0 || rsiPeriod <= 0 || zScoreWindow <= 0) {
            throw new IllegalArgumentException("periods must be positive");
        }
        if (stationarityMinPoints < 2 || volatilityMinReturns < 1 || anomalyMinPoints < 1) {
            throw new IllegalArgumentException("minimum point counts are too small");
        }
        if (garchAlpha < 0 || garchBeta < 0 || garchAlpha + garchBeta > 1) {
            throw new IllegalArgumentException("garch coefficients must be non-negative and sum to at most 1");
        }
        if (anomalyZThreshold <= 0) {
            throw new IllegalArgumentException("anomalyZThreshold must be positive");
        }
    }
}
