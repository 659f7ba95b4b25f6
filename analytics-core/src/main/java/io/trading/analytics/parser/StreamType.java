package io.trading.analytics.parser;

/**
 * Trade stream flavours offered by the exchange.
 */
public enum StreamType {
    TRADE("trade"),
    AGG_TRADE("aggTrade");

    private final String streamName;

    StreamType(String streamName) {
        this.streamName = streamName;
    }

    /**
     * Gets the stream suffix used in subscriptions and the event type of its messages.
     */
    public String getStreamName() {
        return streamName;
    }

    /**
     * Resolves a stream type from its exchange name, case-insensitively.
     */
    public static StreamType fromName(String name) {
        for (StreamType type : values()) {
            if (type.streamName.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stream type: " + name);
    }
}
