package io.trading.analytics.gateway.aeron;

import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.AtomicBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.OptionalDouble;

/**
 * Binary encoder for records published over Aeron.
 *
 * Binary format:
 * - 1-byte record type (1=Window, 2=Metrics, 3=Alert)
 * - int64 timestamps and int32 counts, big-endian
 * - float64 values, big-endian IEEE 754
 * - Strings as 1-byte length + UTF-8 bytes, at most 255 bytes
 * - Optional metrics as one presence bitmask byte followed by every value, NaN when absent
 *
 * Window:  type, timestamp, instrument, mean, std, min, max, volume, tradeCount, vwap
 * Metrics: type, timestamp, instrument, mean, std, volatility, zScore, sma, ema, rsi,
 *          presence, correlation, garch, adf, trend ordinal
 * Alert:   type, ruleId, timestamp, instrument, metric, actual, threshold
 */
public final class RecordEncoder {

    public static final int PRESENT_CORRELATION = 1;
    public static final int PRESENT_GARCH = 1 << 1;
    public static final int PRESENT_ADF = 1 << 2;

    static final int MAX_STRING_LENGTH = 255;

    private static final int WINDOW_SIZE = 384;
    private static final int METRICS_SIZE = 384;
    private static final int ALERT_SIZE = 1024;

    private RecordEncoder() {}

    /**
     * Encodes a window at offset 0.
     * @return The encoded length
     */
    public static int encodeWindow(MutableDirectBuffer buffer, AggregatedWindow window) {
        int pos = 0;
        buffer.putByte(pos, RecordType.WINDOW.code());
        pos += 1;
        buffer.putLong(pos, window.timestamp(), ByteOrder.BIG_ENDIAN);
        pos += 8;
        pos += putString(buffer, pos, window.instrumentId());

        pos = putDouble(buffer, pos, window.meanPrice());
        pos = putDouble(buffer, pos, window.stdPrice());
        pos = putDouble(buffer, pos, window.minPrice());
        pos = putDouble(buffer, pos, window.maxPrice());
        pos = putDouble(buffer, pos, window.totalVolume());

        buffer.putInt(pos, window.tradeCount(), ByteOrder.BIG_ENDIAN);
        pos += 4;
        return putDouble(buffer, pos, window.vwap());
    }

    /**
     * Encodes a metrics snapshot at offset 0.
     * @return The encoded length
     */
    public static int encodeMetrics(MutableDirectBuffer buffer, MetricsSnapshot snapshot) {
        int pos = 0;
        buffer.putByte(pos, RecordType.METRICS.code());
        pos += 1;
        buffer.putLong(pos, snapshot.timestamp(), ByteOrder.BIG_ENDIAN);
        pos += 8;
        pos += putString(buffer, pos, snapshot.instrumentId());

        pos = putDouble(buffer, pos, snapshot.meanPrice());
        pos = putDouble(buffer, pos, snapshot.stdPrice());
        pos = putDouble(buffer, pos, snapshot.volatility());
        pos = putDouble(buffer, pos, snapshot.zScore());
        pos = putDouble(buffer, pos, snapshot.sma20());
        pos = putDouble(buffer, pos, snapshot.ema20());
        pos = putDouble(buffer, pos, snapshot.rsi14());

        int presence = 0;
        if (snapshot.correlation().isPresent()) {
            presence |= PRESENT_CORRELATION;
        }
        if (snapshot.garchForecast().isPresent()) {
            presence |= PRESENT_GARCH;
        }
        if (snapshot.adfPValue().isPresent()) {
            presence |= PRESENT_ADF;
        }
        buffer.putByte(pos, (byte) presence);
        pos += 1;

        pos = putDouble(buffer, pos, orNaN(snapshot.correlation()));
        pos = putDouble(buffer, pos, orNaN(snapshot.garchForecast()));
        pos = putDouble(buffer, pos, orNaN(snapshot.adfPValue()));

        buffer.putByte(pos, (byte) snapshot.trend().ordinal());
        return pos + 1;
    }

    /**
     * Encodes an alert event at offset 0.
     * @return The encoded length
     */
    public static int encodeAlert(MutableDirectBuffer buffer, AlertEvent event) {
        int pos = 0;
        buffer.putByte(pos, RecordType.ALERT.code());
        pos += 1;
        pos += putString(buffer, pos, event.ruleId());
        buffer.putLong(pos, event.timestamp(), ByteOrder.BIG_ENDIAN);
        pos += 8;
        pos += putString(buffer, pos, event.instrumentId());
        pos += putString(buffer, pos, event.metricName());
        pos = putDouble(buffer, pos, event.actualValue());
        return putDouble(buffer, pos, event.threshold());
    }

    public static AtomicBuffer newWindowBuffer() {
        return new UnsafeBuffer(new byte[WINDOW_SIZE]);
    }

    public static AtomicBuffer newMetricsBuffer() {
        return new UnsafeBuffer(new byte[METRICS_SIZE]);
    }

    public static AtomicBuffer newAlertBuffer() {
        return new UnsafeBuffer(new byte[ALERT_SIZE]);
    }

    /**
     * Writes a length-prefixed string.
     * @return The number of bytes written
     */
    private static int putString(MutableDirectBuffer buffer, int pos, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH) {
            throw new IllegalArgumentException("String longer than " + MAX_STRING_LENGTH + " bytes: " + value);
        }
        buffer.putByte(pos, (byte) bytes.length);
        buffer.putBytes(pos + 1, bytes);
        return 1 + bytes.length;
    }

    private static int putDouble(MutableDirectBuffer buffer, int pos, double value) {
        buffer.putDouble(pos, value, ByteOrder.BIG_ENDIAN);
        return pos + 8;
    }

    private static double orNaN(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : Double.NaN;
    }
}
