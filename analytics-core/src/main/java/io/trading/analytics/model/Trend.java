package io.trading.analytics.model;

/**
 * Direction derived from the latest price and its moving averages.
 */
public enum Trend {
    UPTREND("uptrend"),
    DOWNTREND("downtrend"),
    NEUTRAL("neutral");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
