package io.trading.analytics.gateway.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single WebSocket connection over Netty. {@link #connect()} blocks until the handshake
 * has completed or failed; {@link #awaitClose()} blocks until the connection drops.
 *
 * <p>A client is good for one connection. Reconnecting means creating a new one.
 */
public class WebSocketClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final long HANDSHAKE_TIMEOUT_MS = 10000;
    private static final int CONNECT_TIMEOUT_MS = 10000;
    private static final int MAX_FRAME_PAYLOAD = 1 << 20;

    private final URI uri;
    private final String name;
    private final Consumer<String> messageHandler;
    private final boolean enableCompression;

    private EventLoopGroup eventLoopGroup;
    private volatile Channel channel;

    /**
     * @param uri               WebSocket URI ({@code ws} or {@code wss})
     * @param name              Friendly name used in logs and thread names
     * @param messageHandler    Receives every text frame, on the event loop thread
     * @param enableCompression Whether to offer permessage-deflate
     */
    public WebSocketClient(URI uri, String name, Consumer<String> messageHandler, boolean enableCompression) {
        this.uri = uri;
        this.name = name;
        this.messageHandler = messageHandler;
        this.enableCompression = enableCompression;
    }

    /**
     * Connects and performs the WebSocket handshake.
     *
     * @throws IOException          if the TCP connect or the handshake fails or times out
     * @throws InterruptedException if interrupted while waiting
     */
    public void connect() throws IOException, InterruptedException {
        if (channel != null) {
            throw new IllegalStateException(name + ": already connected");
        }

        String scheme = uri.getScheme() == null ? "ws" : uri.getScheme().toLowerCase();
        boolean secure = "wss".equals(scheme);
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? buildSslContext() : null;

        WebSocketClientHandler handler = new WebSocketClientHandler(uri, name, messageHandler, MAX_FRAME_PAYLOAD);
        eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name + "-io");

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(8192));
                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        try {
            Channel connected = bootstrap.connect(host, port).sync().channel();
            if (!handler.handshakeFuture().await(HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                throw new IOException(name + ": WebSocket handshake timed out");
            }
            if (!handler.handshakeFuture().isSuccess()) {
                throw new IOException(name + ": WebSocket handshake failed", handler.handshakeFuture().cause());
            }
            channel = connected;
            LOGGER.info("{}: Connected to {}", name, uri);
        } catch (IOException | InterruptedException e) {
            close();
            throw e;
        } catch (Exception e) {
            // Netty rethrows connect failures unchecked from sync()
            close();
            throw new IOException(name + ": Failed to connect to " + uri, e);
        }
    }

    /**
     * Blocks until the connection is closed by either side.
     */
    public void awaitClose() throws InterruptedException {
        Channel current = channel;
        if (current != null) {
            current.closeFuture().await();
        }
    }

    @Override
    public void close() {
        Channel current = channel;
        channel = null;
        if (current != null) {
            current.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            eventLoopGroup = null;
        }
        LOGGER.debug("{}: Closed", name);
    }

    private SslContext buildSslContext() throws IOException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        } catch (SSLException e) {
            throw new IOException(name + ": Failed to create SSL context", e);
        }
    }
}
