package io.trading.analytics.model;

/**
 * A single executed trade received from the exchange feed.
 *
 * @param timestamp    Trade timestamp in milliseconds since epoch
 * @param instrumentId Instrument symbol (e.g., "BTCUSDT")
 * @param price        Trade price, strictly positive
 * @param quantity     Trade quantity, zero or positive
 */
public record TradeEvent(
    long timestamp,
    String instrumentId,
    double price,
    double quantity
) {
    public TradeEvent {
        if (instrumentId == null || instrumentId.isEmpty()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("price must be positive and finite: " + price);
        }
        if (!(quantity >= 0) || Double.isInfinite(quantity)) {
            throw new IllegalArgumentException("quantity must be non-negative and finite: " + quantity);
        }
    }
}
