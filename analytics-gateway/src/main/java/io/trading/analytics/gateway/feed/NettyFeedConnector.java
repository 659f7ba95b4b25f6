package io.trading.analytics.gateway.feed;

import io.trading.analytics.gateway.netty.WebSocketClient;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Feed connector over a Netty WebSocket client. Each call opens a fresh client with its
 * own event loop.
 */
public class NettyFeedConnector implements FeedConnector {

    private final String name;
    private final boolean enableCompression;

    public NettyFeedConnector(String name, boolean enableCompression) {
        this.name = name;
        this.enableCompression = enableCompression;
    }

    @Override
    public FeedSession open(URI uri, Consumer<String> messageHandler) throws Exception {
        WebSocketClient client = new WebSocketClient(uri, name, messageHandler, enableCompression);
        client.connect();
        return new FeedSession() {
            @Override
            public void awaitClose() throws InterruptedException {
                client.awaitClose();
            }

            @Override
            public void close() {
                client.close();
            }
        };
    }
}
