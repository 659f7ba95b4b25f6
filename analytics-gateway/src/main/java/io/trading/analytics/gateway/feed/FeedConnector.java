package io.trading.analytics.gateway.feed;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Opens feed connections. The returned session delivers every text message to
 * {@code messageHandler} until it closes.
 */
@FunctionalInterface
public interface FeedConnector {

    /**
     * @throws Exception if the connection cannot be established
     */
    FeedSession open(URI uri, Consumer<String> messageHandler) throws Exception;
}
