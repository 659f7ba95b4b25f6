package io.trading.analytics.gateway.feed;

/**
 * One established feed connection.
 */
public interface FeedSession extends AutoCloseable {

    /**
     * Blocks until the connection is closed by the remote side, a transport error or
     * {@link #close()}.
     */
    void awaitClose() throws InterruptedException;

    @Override
    void close();
}
