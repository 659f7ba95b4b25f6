package io.trading.analytics.gateway.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.analytics.gateway.feed.FeedListener;
import io.trading.analytics.gateway.feed.FeedState;

/**
 * Prometheus metrics for the analytics gateway.
 *
 * Tracks:
 * - Ticks received, dropped by the tick channel and rejected as malformed
 * - Feed state and reconnect attempts
 * - Windows flushed, alerts triggered and flush latency
 * - Record publication failures per sink
 */
public class GatewayMetrics implements FeedListener {

    private final CollectorRegistry registry;

    private final Counter ticksReceived;
    private final Counter ticksDropped;
    private final Counter parseErrors;
    private final Counter reconnectAttempts;
    private final Counter windowsFlushed;
    private final Counter alertsTriggered;
    private final Counter publicationFailures;

    private final Gauge feedState;
    private final Gauge tickQueueDepth;

    private final Summary flushLatency;

    /**
     * Registers on the default registry together with the JVM exports.
     */
    public GatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    public GatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticksReceived = Counter.build()
            .name("analytics_ticks_received_total")
            .help("Total number of trades parsed from the feed")
            .register(registry);

        this.ticksDropped = Counter.build()
            .name("analytics_ticks_dropped_total")
            .help("Trades discarded because the tick channel was full")
            .register(registry);

        this.parseErrors = Counter.build()
            .name("analytics_parse_errors_total")
            .help("Feed messages dropped as malformed")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("analytics_reconnect_attempts_total")
            .help("Total number of feed reconnection attempts")
            .register(registry);

        this.windowsFlushed = Counter.build()
            .name("analytics_windows_flushed_total")
            .help("Aggregated windows produced by flushes")
            .register(registry);

        this.alertsTriggered = Counter.build()
            .name("analytics_alerts_triggered_total")
            .help("Alert events produced by rule evaluation")
            .register(registry);

        this.publicationFailures = Counter.build()
            .name("analytics_publication_failures_total")
            .help("Records a sink failed to publish")
            .labelNames("sink")
            .register(registry);

        this.feedState = Gauge.build()
            .name("analytics_feed_state")
            .help("Feed state (0=DISCONNECTED 1=CONNECTING 2=CONNECTED 3=RECONNECTING 4=FAILED 5=CLOSED)")
            .register(registry);

        this.tickQueueDepth = Gauge.build()
            .name("analytics_tick_queue_depth")
            .help("Trades waiting in the tick channel")
            .register(registry);

        this.flushLatency = Summary.build()
            .name("analytics_flush_latency_milliseconds")
            .help("Time spent in one flush")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    @Override
    public void onStateChange(FeedState state) {
        feedState.set(state.code());
    }

    @Override
    public void onTick() {
        ticksReceived.inc();
    }

    @Override
    public void onParseError() {
        parseErrors.inc();
    }

    @Override
    public void onReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordTickDropped() {
        ticksDropped.inc();
    }

    public void setTickQueueDepth(int depth) {
        tickQueueDepth.set(depth);
    }

    /**
     * Records one completed flush.
     */
    public void recordFlush(int windows, int alerts, double latencyMillis) {
        windowsFlushed.inc(windows);
        alertsTriggered.inc(alerts);
        flushLatency.observe(latencyMillis);
    }

    public void recordPublicationFailure(String sink) {
        publicationFailures.labels(sink).inc();
    }

    public double getTicksReceived() {
        return ticksReceived.get();
    }

    public double getTicksDropped() {
        return ticksDropped.get();
    }

    public double getParseErrors() {
        return parseErrors.get();
    }

    public double getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public double getWindowsFlushed() {
        return windowsFlushed.get();
    }

    public double getAlertsTriggered() {
        return alertsTriggered.get();
    }

    public double getPublicationFailures(String sink) {
        return publicationFailures.labels(sink).get();
    }

    public double getFeedState() {
        return feedState.get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
