package io.trading.analytics.gateway.config;

import io.trading.analytics.alert.AlertLog;
import io.trading.analytics.aggregation.WindowAggregator;
import io.trading.analytics.gateway.core.TickChannel;
import io.trading.analytics.history.HistoryStore;
import io.trading.analytics.parser.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the analytics gateway.
 *
 * @param gatewayId          Unique gateway instance identifier
 * @param aeronDir           Aeron directory for the embedded media driver
 * @param feed               Feed subscription and reconnect settings
 * @param correlationPairs   Instrument pairs correlated in every snapshot
 * @param flushIntervalMs    Window length
 * @param flushCheckMs       How often the scheduler checks whether a flush is due
 * @param historyCapacity    Windows kept per instrument
 * @param alertLogCapacity   Alert events kept for queries
 * @param tickQueueCapacity  Capacity of the tick channel
 * @param healthCheckMs      Health check interval in milliseconds
 * @param metricsPort        Port for the metrics and status HTTP server
 * @param sinks              Record destinations
 */
public record GatewayConfig(
    String gatewayId,
    String aeronDir,
    FeedConfig feed,
    List<CorrelationPair> correlationPairs,
    long flushIntervalMs,
    long flushCheckMs,
    int historyCapacity,
    int alertLogCapacity,
    int tickQueueCapacity,
    int healthCheckMs,
    int metricsPort,
    Set<SinkType> sinks
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayConfig.class);

    private static final String DEFAULT_GATEWAY_ID = "analytics-0";
    private static final String DEFAULT_FEED_URL = "wss://fstream.binance.com/stream";
    private static final String DEFAULT_INSTRUMENTS = "BTCUSDT,ETHUSDT";
    private static final String DEFAULT_CORRELATION_PAIRS = "BTCUSDT:ETHUSDT";
    private static final int DEFAULT_FLUSH_CHECK_MS = 250;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = 10;
    private static final int DEFAULT_RECONNECT_BASE_MS = 1000;
    private static final int DEFAULT_RECONNECT_MAX_MS = 60_000;
    private static final int DEFAULT_RECONNECT_JITTER_MS = 1000;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public GatewayConfig {
        if (gatewayId == null || gatewayId.isEmpty()) {
            throw new IllegalArgumentException("gatewayId cannot be null or empty");
        }
        if (aeronDir == null || aeronDir.isEmpty()) {
            throw new IllegalArgumentException("aeronDir cannot be null or empty");
        }
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        if (correlationPairs == null) {
            throw new IllegalArgumentException("correlationPairs cannot be null");
        }
        if (flushIntervalMs <= 0 || flushCheckMs <= 0) {
            throw new IllegalArgumentException("flushIntervalMs and flushCheckMs must be positive");
        }
        if (historyCapacity < 2) {
            throw new IllegalArgumentException("historyCapacity must be at least 2");
        }
        if (alertLogCapacity < 1 || tickQueueCapacity < 1) {
            throw new IllegalArgumentException("alertLogCapacity and tickQueueCapacity must be positive");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("sinks cannot be null or empty");
        }
        correlationPairs = List.copyOf(correlationPairs);
        sinks = Set.copyOf(sinks);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - GATEWAY_ID: Gateway instance ID (default: "analytics-0")
     * - FEED_URL: Combined stream endpoint (default: "wss://fstream.binance.com/stream")
     * - INSTRUMENTS: Comma separated symbols (default: "BTCUSDT,ETHUSDT")
     * - STREAM_TYPE: "aggTrade" or "trade" (default: "aggTrade")
     * - CORRELATION_PAIRS: e.g. "BTCUSDT:ETHUSDT;SOLUSDT:AVAXUSDT" (default: "BTCUSDT:ETHUSDT")
     * - FLUSH_INTERVAL_MS / FLUSH_CHECK_MS: Window length and scheduler tick (default: 5000 / 250)
     * - HISTORY_CAPACITY / ALERT_LOG_CAPACITY / TICK_QUEUE_CAPACITY (default: 500 / 1000 / 65536)
     * - RECONNECT_MAX_RETRIES / RECONNECT_BASE_MS / RECONNECT_MAX_MS / RECONNECT_JITTER_MS
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - METRICS_PORT: HTTP port (default: 9090)
     * - SINKS: "log", "aeron" or both, comma separated (default: "log")
     * - AERON_DIR: Aeron directory (default: "/dev/shm/trade-analytics-{gatewayId}")
     */
    public static GatewayConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Loads configuration from the given variables, falling back to defaults for
     * missing or blank entries.
     */
    public static GatewayConfig fromMap(Map<String, String> env) {
        String gatewayId = stringEnv(env, "GATEWAY_ID", DEFAULT_GATEWAY_ID);

        List<String> instruments = Arrays.stream(stringEnv(env, "INSTRUMENTS", DEFAULT_INSTRUMENTS).split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.toUpperCase(Locale.ROOT))
            .distinct()
            .collect(Collectors.toList());

        FeedConfig feed = new FeedConfig(
            stringEnv(env, "FEED_URL", DEFAULT_FEED_URL),
            instruments,
            StreamType.fromName(stringEnv(env, "STREAM_TYPE", StreamType.AGG_TRADE.getStreamName())),
            true,
            parseIntEnv(env, "RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES),
            parseIntEnv(env, "RECONNECT_BASE_MS", DEFAULT_RECONNECT_BASE_MS),
            parseIntEnv(env, "RECONNECT_MAX_MS", DEFAULT_RECONNECT_MAX_MS),
            parseIntEnv(env, "RECONNECT_JITTER_MS", DEFAULT_RECONNECT_JITTER_MS)
        );

        List<CorrelationPair> pairs = Arrays.stream(stringEnv(env, "CORRELATION_PAIRS", DEFAULT_CORRELATION_PAIRS).split("[;,]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(CorrelationPair::fromString)
            .collect(Collectors.toList());

        Set<SinkType> sinks = Arrays.stream(stringEnv(env, "SINKS", SinkType.LOG.getConfigName()).split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(SinkType::fromString)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(SinkType.class)));

        return new GatewayConfig(
            gatewayId,
            stringEnv(env, "AERON_DIR", defaultAeronDir(gatewayId)),
            feed,
            pairs,
            parseIntEnv(env, "FLUSH_INTERVAL_MS", (int) WindowAggregator.DEFAULT_FLUSH_INTERVAL_MS),
            parseIntEnv(env, "FLUSH_CHECK_MS", DEFAULT_FLUSH_CHECK_MS),
            parseIntEnv(env, "HISTORY_CAPACITY", HistoryStore.DEFAULT_CAPACITY),
            parseIntEnv(env, "ALERT_LOG_CAPACITY", AlertLog.DEFAULT_CAPACITY),
            parseIntEnv(env, "TICK_QUEUE_CAPACITY", TickChannel.DEFAULT_CAPACITY),
            parseIntEnv(env, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            parseIntEnv(env, "METRICS_PORT", DEFAULT_METRICS_PORT),
            sinks
        );
    }

    private static String defaultAeronDir(String gatewayId) {
        return "/dev/shm/trade-analytics-" + gatewayId;
    }

    private static String stringEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static int parseIntEnv(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String gatewayId = DEFAULT_GATEWAY_ID;
        private String aeronDir;
        private String feedUrl = DEFAULT_FEED_URL;
        private final List<String> instruments = new ArrayList<>();
        private StreamType streamType = StreamType.AGG_TRADE;
        private final List<CorrelationPair> correlationPairs = new ArrayList<>();
        private long flushIntervalMs = WindowAggregator.DEFAULT_FLUSH_INTERVAL_MS;
        private long flushCheckMs = DEFAULT_FLUSH_CHECK_MS;
        private int historyCapacity = HistoryStore.DEFAULT_CAPACITY;
        private int alertLogCapacity = AlertLog.DEFAULT_CAPACITY;
        private int tickQueueCapacity = TickChannel.DEFAULT_CAPACITY;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private final Set<SinkType> sinks = EnumSet.noneOf(SinkType.class);

        public Builder gatewayId(String gatewayId) {
            this.gatewayId = gatewayId;
            return this;
        }

        public Builder aeronDir(String aeronDir) {
            this.aeronDir = aeronDir;
            return this;
        }

        public Builder feedUrl(String feedUrl) {
            this.feedUrl = feedUrl;
            return this;
        }

        public Builder addInstrument(String instrument) {
            this.instruments.add(instrument.toUpperCase(Locale.ROOT));
            return this;
        }

        public Builder streamType(StreamType streamType) {
            this.streamType = streamType;
            return this;
        }

        public Builder correlate(String first, String second) {
            this.correlationPairs.add(new CorrelationPair(first, second));
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        public Builder flushCheckMs(long flushCheckMs) {
            this.flushCheckMs = flushCheckMs;
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder alertLogCapacity(int alertLogCapacity) {
            this.alertLogCapacity = alertLogCapacity;
            return this;
        }

        public Builder tickQueueCapacity(int tickQueueCapacity) {
            this.tickQueueCapacity = tickQueueCapacity;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder addSink(SinkType sink) {
            this.sinks.add(sink);
            return this;
        }

        public GatewayConfig build() {
            if (instruments.isEmpty()) {
                throw new IllegalStateException("At least one instrument must be added");
            }
            if (sinks.isEmpty()) {
                sinks.add(SinkType.LOG);
            }
            FeedConfig feed = new FeedConfig(
                feedUrl,
                instruments,
                streamType,
                true,
                reconnectMaxRetries,
                DEFAULT_RECONNECT_BASE_MS,
                DEFAULT_RECONNECT_MAX_MS,
                DEFAULT_RECONNECT_JITTER_MS
            );
            return new GatewayConfig(
                gatewayId,
                aeronDir == null || aeronDir.isEmpty() ? defaultAeronDir(gatewayId) : aeronDir,
                feed,
                correlationPairs,
                flushIntervalMs,
                flushCheckMs,
                historyCapacity,
                alertLogCapacity,
                tickQueueCapacity,
                healthCheckMs,
                metricsPort,
                sinks
            );
        }
    }
}
