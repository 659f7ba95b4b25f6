package io.trading.analytics.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.trading.analytics.model.TradeEvent;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Streaming parser for Binance {@code trade} and {@code aggTrade} messages.
 *
 * Accepts both the raw event shape and the combined stream wrapper:
 * <pre>
 * {"stream":"btcusdt@aggTrade","data":{"e":"aggTrade","E":1704067200000,"s":"BTCUSDT","p":"43250.50","q":"0.5","T":1704067199990}}
 * </pre>
 *
 * Uses Jackson's token stream instead of building a tree. The event time is taken
 * from {@code T} (trade time), then {@code E} (event time), then the receive clock.
 */
public class BinanceTradeParser implements TradeMessageParser {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final EpochClock clock;

    public BinanceTradeParser() {
        this(SystemEpochClock.INSTANCE);
    }

    public BinanceTradeParser(EpochClock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<TradeEvent> parse(String message) {
        String eventType = null;
        String symbol = null;
        String price = null;
        String quantity = null;
        long tradeTime = 0;
        long eventTime = 0;

        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            String fieldName = null;
            JsonToken token;

            while ((token = parser.nextToken()) != null) {
                switch (token) {
                    case FIELD_NAME:
                        fieldName = parser.currentName();
                        break;
                    case VALUE_STRING:
                        if ("e".equals(fieldName)) {
                            eventType = parser.getText();
                        } else if ("s".equals(fieldName)) {
                            symbol = parser.getText();
                        } else if ("p".equals(fieldName)) {
                            price = parser.getText();
                        } else if ("q".equals(fieldName)) {
                            quantity = parser.getText();
                        }
                        break;
                    case VALUE_NUMBER_INT:
                    case VALUE_NUMBER_FLOAT:
                        if ("T".equals(fieldName)) {
                            tradeTime = parser.getLongValue();
                        } else if ("E".equals(fieldName)) {
                            eventTime = parser.getLongValue();
                        } else if ("p".equals(fieldName)) {
                            price = parser.getText();
                        } else if ("q".equals(fieldName)) {
                            quantity = parser.getText();
                        }
                        break;
                    default:
                        break;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse trade message", e);
        }

        if (eventType != null && !isTradeEventType(eventType)) {
            return Optional.empty();
        }
        if (symbol == null || price == null || quantity == null) {
            return Optional.empty();
        }

        long timestamp = tradeTime > 0 ? tradeTime : (eventTime > 0 ? eventTime : clock.time());

        try {
            return Optional.of(new TradeEvent(
                timestamp,
                symbol.toUpperCase(Locale.ROOT),
                Double.parseDouble(price),
                Double.parseDouble(quantity)
            ));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric price or quantity: p=" + price + ", q=" + quantity, e);
        }
    }

    private static boolean isTradeEventType(String eventType) {
        return StreamType.TRADE.getStreamName().equals(eventType)
            || StreamType.AGG_TRADE.getStreamName().equals(eventType);
    }
}
