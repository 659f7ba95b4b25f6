package io.trading.analytics.model;

/**
 * Trades of one instrument aggregated over one flush interval.
 *
 * @param timestamp    Flush time in milliseconds since epoch
 * @param instrumentId Instrument symbol
 * @param meanPrice    Arithmetic mean of trade prices, within [minPrice, maxPrice]
 * @param stdPrice     Population standard deviation of trade prices
 * @param minPrice     Lowest trade price
 * @param maxPrice     Highest trade price
 * @param totalVolume  Sum of trade quantities
 * @param tradeCount   Number of trades, at least one
 * @param vwap         Volume weighted average price, 0 when total volume is 0
 */
public record AggregatedWindow(
    long timestamp,
    String instrumentId,
    double meanPrice,
    double stdPrice,
    double minPrice,
    double maxPrice,
    double totalVolume,
    int tradeCount,
    double vwap
) {
    public AggregatedWindow {
        if (instrumentId == null || instrumentId.isEmpty()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
        if (tradeCount < 1) {
            throw new IllegalArgumentException("tradeCount must be at least 1");
        }
        if (minPrice > maxPrice) {
            throw new IllegalArgumentException("minPrice cannot exceed maxPrice");
        }
        if (meanPrice < minPrice || meanPrice > maxPrice) {
            throw new IllegalArgumentException("meanPrice must lie within [minPrice, maxPrice]");
        }
    }
}
