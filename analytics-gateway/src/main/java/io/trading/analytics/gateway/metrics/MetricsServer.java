package io.trading.analytics.gateway.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.analytics.engine.AnalyticsEngine;
import io.trading.analytics.gateway.core.TickChannel;
import io.trading.analytics.gateway.feed.FeedClient;
import io.trading.analytics.gateway.feed.FeedState;
import io.trading.analytics.gateway.feed.FeedStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP server exposing Prometheus metrics, a health probe and a JSON status view.
 *
 * <ul>
 *   <li>{@code /metrics}: Prometheus text format</li>
 *   <li>{@code /health}: 200 {@code OK}, or 503 once the feed has exhausted its retries</li>
 *   <li>{@code /api/status}: feed, tick channel and engine counters</li>
 * </ul>
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final String gatewayId;
    private final GatewayMetrics metrics;
    private final FeedClient feedClient;
    private final AnalyticsEngine engine;
    private final TickChannel tickChannel;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(
        int port,
        String gatewayId,
        GatewayMetrics metrics,
        FeedClient feedClient,
        AnalyticsEngine engine,
        TickChannel tickChannel
    ) {
        this.port = port;
        this.gatewayId = gatewayId;
        this.metrics = metrics;
        this.feedClient = feedClient;
        this.engine = engine;
        this.tickChannel = tickChannel;
        this.objectMapper = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.startTime = System.currentTimeMillis();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());
        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:     http://localhost:{}/health", getPort());
        LOGGER.info("  API Status: http://localhost:{}/api/status", getPort());
    }

    /**
     * Gets the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                metrics.setTickQueueDepth(tickChannel.size());
                Writer writer = new StringWriter();
                TextFormat.write004(writer, metrics.getRegistry().metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                FeedState state = feedClient.state();
                if (state == FeedState.FAILED) {
                    sendResponse(exchange, 503, "text/plain", "FAILED: feed " + feedClient.getName() + " gave up reconnecting");
                } else {
                    sendResponse(exchange, 200, "text/plain", "OK");
                }
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                StatusResponse status = new StatusResponse(
                    gatewayId,
                    System.currentTimeMillis() - startTime,
                    feedClient.status(),
                    new TickChannelInfo(tickChannel.size(), tickChannel.capacity(), tickChannel.dropped()),
                    new EngineInfo(
                        engine.getTradesReceived(),
                        engine.getPendingTrades(),
                        engine.getWindowsFlushed(),
                        engine.getAlertsTriggered(),
                        engine.getLastFlushTime(),
                        engine.getFlushIntervalMs(),
                        engine.rules().size(),
                        engine.trackedInstruments()
                    )
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
                sendResponse(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            server = null;
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String gatewayId, long uptimeMs, FeedStatus feed, TickChannelInfo tickChannel,
                                  EngineInfo engine) {}
    private record TickChannelInfo(int depth, int capacity, long dropped) {}
    private record EngineInfo(long tradesReceived, int pendingTrades, long windowsFlushed, long alertsTriggered,
                              long lastFlushTime, long flushIntervalMs, int alertRules, List<String> instruments) {}
}
