package io.trading.analytics.parser;

import io.trading.analytics.model.TradeEvent;

import java.util.Optional;

/**
 * Parses raw WebSocket messages from an exchange into trade events.
 * Implementations should be cheap enough to run on the network thread.
 */
public interface TradeMessageParser {

    /**
     * Parses a message into a trade event.
     *
     * @param message The raw JSON message from the exchange
     * @return the trade, or empty when the message is not a trade (subscription acks, other events)
     * @throws IllegalArgumentException if the message claims to be a trade but its values are invalid
     * @throws java.io.UncheckedIOException if the message is not valid JSON
     */
    Optional<TradeEvent> parse(String message);
}
