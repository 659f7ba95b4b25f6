package io.trading.analytics.gateway.config;

import io.trading.analytics.parser.StreamType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @Test
    void testDefaults() {
        GatewayConfig config = GatewayConfig.fromMap(Map.of());

        assertEquals("analytics-0", config.gatewayId());
        assertEquals("/dev/shm/trade-analytics-analytics-0", config.aeronDir());
        assertEquals(List.of("BTCUSDT", "ETHUSDT"), config.feed().instruments());
        assertEquals(StreamType.AGG_TRADE, config.feed().streamType());
        assertEquals(10, config.feed().maxRetries());
        assertEquals(1_000, config.feed().backoffBaseMs());
        assertEquals(60_000, config.feed().backoffMaxMs());
        assertEquals(1_000, config.feed().backoffJitterMs());
        assertEquals(List.of(new CorrelationPair("BTCUSDT", "ETHUSDT")), config.correlationPairs());
        assertEquals(5_000, config.flushIntervalMs());
        assertEquals(250, config.flushCheckMs());
        assertEquals(500, config.historyCapacity());
        assertEquals(1_000, config.alertLogCapacity());
        assertEquals(65_536, config.tickQueueCapacity());
        assertEquals(5_000, config.healthCheckMs());
        assertEquals(9090, config.metricsPort());
        assertEquals(Set.of(SinkType.LOG), config.sinks());
    }

    @Test
    void testOverrides() {
        GatewayConfig config = GatewayConfig.fromMap(Map.of(
            "GATEWAY_ID", "analytics-7",
            "INSTRUMENTS", " solusdt, avaxusdt ,SOLUSDT",
            "STREAM_TYPE", "trade",
            "CORRELATION_PAIRS", "SOLUSDT:AVAXUSDT;btcusdt:ethusdt",
            "FLUSH_INTERVAL_MS", "1000",
            "SINKS", "log,aeron",
            "METRICS_PORT", "0"
        ));

        assertEquals("analytics-7", config.gatewayId());
        assertEquals("/dev/shm/trade-analytics-analytics-7", config.aeronDir());
        assertEquals(List.of("SOLUSDT", "AVAXUSDT"), config.feed().instruments());
        assertEquals(StreamType.TRADE, config.feed().streamType());
        assertEquals(List.of(new CorrelationPair("SOLUSDT", "AVAXUSDT"), new CorrelationPair("BTCUSDT", "ETHUSDT")),
            config.correlationPairs());
        assertEquals(1_000, config.flushIntervalMs());
        assertEquals(Set.of(SinkType.LOG, SinkType.AERON), config.sinks());
        assertEquals(0, config.metricsPort());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        GatewayConfig config = GatewayConfig.fromMap(Map.of("HISTORY_CAPACITY", "lots"));
        assertEquals(500, config.historyCapacity());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromMap(Map.of("SINKS", "kafka")));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromMap(Map.of("STREAM_TYPE", "depth")));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromMap(Map.of("CORRELATION_PAIRS", "BTCUSDT")));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromMap(Map.of("FLUSH_INTERVAL_MS", "0")));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromMap(Map.of("METRICS_PORT", "70000")));
    }

    @Test
    void testBuilder() {
        GatewayConfig config = GatewayConfig.builder()
            .gatewayId("test")
            .addInstrument("btcusdt")
            .addInstrument("ETHUSDT")
            .correlate("BTCUSDT", "ETHUSDT")
            .flushIntervalMs(1_000)
            .metricsPort(0)
            .build();

        assertEquals("test", config.gatewayId());
        assertEquals(List.of("BTCUSDT", "ETHUSDT"), config.feed().instruments());
        assertEquals(Set.of(SinkType.LOG), config.sinks());
        assertEquals("/dev/shm/trade-analytics-test", config.aeronDir());
    }

    @Test
    void testBuilderRequiresInstrument() {
        assertThrows(IllegalStateException.class, () -> GatewayConfig.builder().build());
    }

    @Test
    void testCorrelationPairParsing() {
        assertEquals(new CorrelationPair("BTCUSDT", "ETHUSDT"), CorrelationPair.fromString(" btcusdt : ethusdt "));
        assertEquals("BTCUSDT:ETHUSDT", CorrelationPair.fromString("BTCUSDT:ETHUSDT").toString());
        assertThrows(IllegalArgumentException.class, () -> CorrelationPair.fromString("BTCUSDT:BTCUSDT"));
        assertThrows(IllegalArgumentException.class, () -> CorrelationPair.fromString("A:B:C"));
    }
}
