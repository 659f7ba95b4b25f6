package io.trading.analytics.gateway.feed;

/**
 * Callbacks for feed events, used to drive metrics.
 */
public interface FeedListener {

    FeedListener NOOP = new FeedListener() {
    };

    default void onStateChange(FeedState state) {
    }

    default void onTick() {
    }

    default void onParseError() {
    }

    default void onReconnectAttempt() {
    }
}
