package io.trading.analytics.alert;

import io.trading.analytics.model.MetricsSnapshot;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Snapshot fields an alert rule may watch, with the names rules refer to them by.
 */
public enum AlertMetric {
    Z_SCORE("z_score"),
    VOLATILITY("volatility"),
    MEAN_PRICE("mean_price", "price"),
    RSI_14("rsi_14", "rsi");

    private final String metricName;
    private final Set<String> aliases;

    AlertMetric(String metricName, String... aliases) {
        this.metricName = metricName;
        this.aliases = Set.of(aliases);
    }

    public String getMetricName() {
        return metricName;
    }

    public OptionalDouble resolve(MetricsSnapshot snapshot) {
        double value = switch (this) {
            case Z_SCORE -> snapshot.zScore();
            case VOLATILITY -> snapshot.volatility();
            case MEAN_PRICE -> snapshot.meanPrice();
            case RSI_14 -> snapshot.rsi14();
        };
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public static Optional<AlertMetric> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AlertMetric metric : values()) {
            if (metric.metricName.equals(normalized) || metric.aliases.contains(normalized)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
