package io.trading.analytics.gateway.aeron;

import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.Trend;
import org.agrona.concurrent.AtomicBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class RecordEncoderTest {

    @Test
    void testWindowLayoutIsBigEndian() {
        AtomicBuffer buffer = RecordEncoder.newWindowBuffer();
        AggregatedWindow window = new AggregatedWindow(1_704_067_205_000L, "BTCUSDT",
            43_250.5, 12.25, 43_200.0, 43_300.0, 7.5, 42, 43_251.0);

        int length = RecordEncoder.encodeWindow(buffer, window);

        // type + timestamp + (1 + 7) symbol + 5 doubles + int + double
        assertEquals(1 + 8 + 8 + 40 + 4 + 8, length);
        assertEquals(RecordType.WINDOW, RecordDecoder.getRecordType(buffer, 0));
        assertEquals(1_704_067_205_000L, buffer.getLong(1, ByteOrder.BIG_ENDIAN));
        assertEquals(7, buffer.getByte(9));
        assertEquals(window, RecordDecoder.decodeWindow(buffer, 0));
    }

    @Test
    void testMetricsKeepsOptionalPresence() {
        AtomicBuffer buffer = RecordEncoder.newMetricsBuffer();
        MetricsSnapshot snapshot = new MetricsSnapshot(1_000L, "ETHUSDT", 2_300.0, 4.0, 0.0017, -1.25,
            2_301.0, 2_299.5, 61.0, OptionalDouble.of(0.93), OptionalDouble.empty(), OptionalDouble.of(0.04),
            Trend.DOWNTREND);

        RecordEncoder.encodeMetrics(buffer, snapshot);
        MetricsSnapshot decoded = RecordDecoder.decodeMetrics(buffer, 0);

        assertEquals(RecordType.METRICS, RecordDecoder.getRecordType(buffer, 0));
        assertEquals(snapshot, decoded);
        assertTrue(decoded.garchForecast().isEmpty());
    }

    @Test
    void testAlert() {
        AtomicBuffer buffer = RecordEncoder.newAlertBuffer();
        AlertEvent event = new AlertEvent("9b2f7c1e-1111-4222-8333-944455556666", 5_000L, "BTCUSDT", "z_score",
            3.16, 2.0);

        RecordEncoder.encodeAlert(buffer, event);

        assertEquals(RecordType.ALERT, RecordDecoder.getRecordType(buffer, 0));
        assertEquals(event, RecordDecoder.decodeAlert(buffer, 0));
    }

    @Test
    void testRejectsOverlongString() {
        AtomicBuffer buffer = RecordEncoder.newAlertBuffer();
        AlertEvent event = new AlertEvent("r".repeat(RecordEncoder.MAX_STRING_LENGTH + 1), 5_000L, "BTCUSDT",
            "z_score", 3.0, 2.0);

        assertThrows(IllegalArgumentException.class, () -> RecordEncoder.encodeAlert(buffer, event));
    }

    @Test
    void testStreamIds() {
        assertEquals(2001, StreamRegistry.getStreamId(RecordType.WINDOW));
        assertEquals(2002, StreamRegistry.getStreamId(RecordType.METRICS));
        assertEquals(2003, StreamRegistry.getStreamId(RecordType.ALERT));
        assertEquals("aeron:ipc?term-length=128k|alias=analytics-alerts", StreamRegistry.getChannel(RecordType.ALERT));
    }
}
