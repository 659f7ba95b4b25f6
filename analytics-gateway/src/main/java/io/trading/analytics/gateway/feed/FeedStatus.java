package io.trading.analytics.gateway.feed;

/**
 * Point-in-time view of the feed connection.
 *
 * @param status            Current state
 * @param uptimeSeconds     Seconds since the current connection was established, 0 when not connected
 * @param ticksReceived     Trades parsed since start
 * @param lastTickTimestamp Exchange timestamp of the newest trade, 0 before the first one
 * @param parseErrors       Messages dropped as malformed
 * @param reconnectAttempts Reconnection attempts since start
 */
public record FeedStatus(
    FeedState status,
    double uptimeSeconds,
    long ticksReceived,
    long lastTickTimestamp,
    long parseErrors,
    long reconnectAttempts
) {
}
