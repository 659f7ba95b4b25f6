package io.trading.analytics.gateway.aeron;

/**
 * Aeron stream allocation for published records.
 *
 * Stream ID allocation:
 * Base:    2000
 * Windows: 2001
 * Metrics: 2002
 * Alerts:  2003
 */
public final class StreamRegistry {

    private static final int BASE_STREAM_ID = 2000;

    private StreamRegistry() {}

    public static int getStreamId(RecordType type) {
        return BASE_STREAM_ID + type.code();
    }

    /**
     * Gets the IPC channel URI of a record type, e.g.
     * {@code aeron:ipc?term-length=128k|alias=analytics-metrics}.
     */
    public static String getChannel(RecordType type) {
        return String.format("aeron:ipc?term-length=128k|alias=analytics-%s", type.getDisplayName());
    }
}
