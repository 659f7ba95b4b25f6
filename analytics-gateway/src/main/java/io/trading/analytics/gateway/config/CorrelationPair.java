package io.trading.analytics.gateway.config;

import java.util.Locale;

/**
 * Two instruments correlated with each other in every metrics snapshot.
 *
 * @param first  First instrument
 * @param second Second instrument
 */
public record CorrelationPair(String first, String second) {

    public CorrelationPair {
        if (first == null || first.isEmpty()) {
            throw new IllegalArgumentException("first cannot be null or empty");
        }
        if (second == null || second.isEmpty()) {
            throw new IllegalArgumentException("second cannot be null or empty");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("an instrument cannot be correlated with itself: " + first);
        }
    }

    /**
     * Parses {@code "BTCUSDT:ETHUSDT"}.
     */
    public static CorrelationPair fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid correlation pair: " + value);
        }
        return new CorrelationPair(
            parts[0].trim().toUpperCase(Locale.ROOT),
            parts[1].trim().toUpperCase(Locale.ROOT)
        );
    }

    @Override
    public String toString() {
        return first + ":" + second;
    }
}
