package io.trading.analytics.gateway.feed;

/**
 * Lifecycle of the feed connection. {@code CONNECTED} is the listening state.
 * {@code FAILED} and {@code CLOSED} are terminal.
 */
public enum FeedState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FAILED,
    CLOSED;

    public boolean isTerminal() {
        return this == FAILED || this == CLOSED;
    }

    /**
     * Numeric code exported as a gauge.
     */
    public int code() {
        return ordinal();
    }
}
