package io.trading.analytics.indicator;

import io.trading.analytics.history.HistorySnapshot;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.Trend;

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derives a {@link MetricsSnapshot} from a history snapshot. Holds configuration only.
 */
public class MetricsComputer {

    private final IndicatorSettings settings;

    public MetricsComputer() {
        this(IndicatorSettings.DEFAULTS);
    }

    public MetricsComputer(IndicatorSettings settings) {
        this.settings = settings;
    }

    /**
     * Computes the metrics of the newest point in {@code history}.
     *
     * @param history   Instrument history including the newest window
     * @param peer      History of the correlated peer instrument, if one is configured
     * @param timestamp Timestamp of the newest window
     */
    public MetricsSnapshot compute(HistorySnapshot history, Optional<HistorySnapshot> peer, long timestamp) {
        double[] prices = history.prices();
        double lastPrice = history.lastPrice();

        double mean = Indicators.mean(prices);
        double std = Indicators.std(prices);
        double volatility = mean > 0 ? std / mean : 0.0;

        double[] recent = Indicators.tail(prices, settings.zScoreWindow());
        double zScore = Indicators.zScore(lastPrice, Indicators.mean(recent), Indicators.std(recent));

        double sma = Indicators.sma(prices, settings.smaPeriod());
        double ema = Indicators.ema(prices, settings.emaPeriod());
        double rsi = Indicators.rsi(prices, settings.rsiPeriod());
        Trend trend = Indicators.trend(sma, ema, lastPrice);

        OptionalDouble adfPValue = Indicators.stationarityPValue(prices, settings.stationarityMinPoints());
        OptionalDouble garchForecast = Indicators.volatilityForecast(
            history.returns(),
            settings.garchAlpha(),
            settings.garchBeta(),
            settings.volatilityMinReturns()
        );
        OptionalDouble correlation = peer
            .map(other -> correlate(history, other))
            .orElse(OptionalDouble.empty());

        return new MetricsSnapshot(
            timestamp,
            history.instrumentId(),
            mean,
            std,
            volatility,
            zScore,
            sma,
            ema,
            rsi,
            correlation,
            garchForecast,
            adfPValue,
            trend
        );
    }

    /**
     * Correlates two histories only when both were last written by the same flush and
     * hold the same number of points; otherwise the pair is not comparable.
     */
    public OptionalDouble correlate(HistorySnapshot a, HistorySnapshot b) {
        if (a.generation() != b.generation() || a.size() != b.size()) {
            return OptionalDouble.empty();
        }
        return Indicators.correlation(a.prices(), b.prices());
    }

    /**
     * Gets the prices whose z-score against the whole series exceeds the threshold in
     * absolute value. Empty when fewer than the configured minimum points are present.
     */
    public double[] anomalies(double[] prices, double zThreshold) {
        if (prices.length < settings.anomalyMinPoints()) {
            return new double[0];
        }
        double mean = Indicators.mean(prices);
        double std = Indicators.std(prices);
        return Arrays.stream(prices)
            .filter(price -> Math.abs(Indicators.zScore(price, mean, std)) > zThreshold)
            .toArray();
    }

    public IndicatorSettings getSettings() {
        return settings;
    }
}
