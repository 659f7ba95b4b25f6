package io.trading.analytics.gateway.config;

import io.trading.analytics.parser.StreamType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedConfigTest {

    @Test
    void testStreamUriJoinsLowercaseStreams() {
        FeedConfig config = new FeedConfig("wss://fstream.binance.com/stream", List.of("BTCUSDT", "ETHUSDT"),
            StreamType.AGG_TRADE, true, 10, 1_000, 60_000, 1_000);

        assertEquals("wss://fstream.binance.com/stream?streams=btcusdt@aggTrade/ethusdt@aggTrade",
            config.streamUri().toString());
    }

    @Test
    void testTradeStreamType() {
        FeedConfig config = new FeedConfig("wss://stream.binance.com:9443/stream", List.of("SOLUSDT"),
            StreamType.TRADE, false, 10, 1_000, 60_000, 1_000);

        assertEquals("wss://stream.binance.com:9443/stream?streams=solusdt@trade", config.streamUri().toString());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            new FeedConfig("", List.of("BTCUSDT"), StreamType.TRADE, false, 10, 1_000, 60_000, 0));
        assertThrows(IllegalArgumentException.class, () ->
            new FeedConfig("wss://x", List.of(), StreamType.TRADE, false, 10, 1_000, 60_000, 0));
        assertThrows(IllegalArgumentException.class, () ->
            new FeedConfig("wss://x", List.of("BTCUSDT"), StreamType.TRADE, false, 0, 1_000, 60_000, 0));
        assertThrows(IllegalArgumentException.class, () ->
            new FeedConfig("wss://x", List.of("BTCUSDT"), StreamType.TRADE, false, 10, 1_000, 500, 0));
    }
}
