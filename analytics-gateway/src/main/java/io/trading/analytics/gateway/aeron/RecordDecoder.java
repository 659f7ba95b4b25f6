package io.trading.analytics.gateway.aeron;

import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.Trend;
import org.agrona.DirectBuffer;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.OptionalDouble;

/**
 * Decodes messages written by {@link RecordEncoder}, for subscribers and tests.
 */
public final class RecordDecoder {

    private static final Trend[] TRENDS = Trend.values();

    private RecordDecoder() {}

    public static RecordType getRecordType(DirectBuffer buffer, int offset) {
        return RecordType.fromCode(buffer.getByte(offset));
    }

    public static AggregatedWindow decodeWindow(DirectBuffer buffer, int offset) {
        Cursor cursor = new Cursor(buffer, offset + 1);
        long timestamp = cursor.getLong();
        String instrumentId = cursor.getString();
        double mean = cursor.getDouble();
        double std = cursor.getDouble();
        double min = cursor.getDouble();
        double max = cursor.getDouble();
        double volume = cursor.getDouble();
        int tradeCount = cursor.getInt();
        double vwap = cursor.getDouble();
        return new AggregatedWindow(timestamp, instrumentId, mean, std, min, max, volume, tradeCount, vwap);
    }

    public static MetricsSnapshot decodeMetrics(DirectBuffer buffer, int offset) {
        Cursor cursor = new Cursor(buffer, offset + 1);
        long timestamp = cursor.getLong();
        String instrumentId = cursor.getString();
        double mean = cursor.getDouble();
        double std = cursor.getDouble();
        double volatility = cursor.getDouble();
        double zScore = cursor.getDouble();
        double sma = cursor.getDouble();
        double ema = cursor.getDouble();
        double rsi = cursor.getDouble();

        int presence = cursor.getByte();
        OptionalDouble correlation = optional(cursor.getDouble(), presence, RecordEncoder.PRESENT_CORRELATION);
        OptionalDouble garch = optional(cursor.getDouble(), presence, RecordEncoder.PRESENT_GARCH);
        OptionalDouble adf = optional(cursor.getDouble(), presence, RecordEncoder.PRESENT_ADF);
        Trend trend = TRENDS[cursor.getByte()];

        return new MetricsSnapshot(timestamp, instrumentId, mean, std, volatility, zScore, sma, ema, rsi,
            correlation, garch, adf, trend);
    }

    public static AlertEvent decodeAlert(DirectBuffer buffer, int offset) {
        Cursor cursor = new Cursor(buffer, offset + 1);
        String ruleId = cursor.getString();
        long timestamp = cursor.getLong();
        String instrumentId = cursor.getString();
        String metricName = cursor.getString();
        double actual = cursor.getDouble();
        double threshold = cursor.getDouble();
        return new AlertEvent(ruleId, timestamp, instrumentId, metricName, actual, threshold);
    }

    private static OptionalDouble optional(double value, int presence, int flag) {
        return (presence & flag) != 0 ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static final class Cursor {
        private final DirectBuffer buffer;
        private int pos;

        Cursor(DirectBuffer buffer, int pos) {
            this.buffer = buffer;
            this.pos = pos;
        }

        int getByte() {
            return buffer.getByte(pos++) & 0xFF;
        }

        int getInt() {
            int value = buffer.getInt(pos, ByteOrder.BIG_ENDIAN);
            pos += 4;
            return value;
        }

        long getLong() {
            long value = buffer.getLong(pos, ByteOrder.BIG_ENDIAN);
            pos += 8;
            return value;
        }

        double getDouble() {
            double value = buffer.getDouble(pos, ByteOrder.BIG_ENDIAN);
            pos += 8;
            return value;
        }

        String getString() {
            int length = getByte();
            byte[] bytes = new byte[length];
            buffer.getBytes(pos, bytes);
            pos += length;
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
