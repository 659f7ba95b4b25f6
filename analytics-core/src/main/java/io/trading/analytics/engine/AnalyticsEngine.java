package io.trading.analytics.engine;

import io.trading.analytics.aggregation.WindowAggregator;
import io.trading.analytics.alert.AlertEvaluator;
import io.trading.analytics.alert.AlertLog;
import io.trading.analytics.alert.AlertRule;
import io.trading.analytics.alert.AlertRuleStore;
import io.trading.analytics.backtest.BacktestResult;
import io.trading.analytics.backtest.BacktestSettings;
import io.trading.analytics.backtest.MeanReversionBacktester;
import io.trading.analytics.cluster.CorrelationClusterer;
import io.trading.analytics.history.HistorySnapshot;
import io.trading.analytics.history.HistoryStore;
import io.trading.analytics.indicator.IndicatorSettings;
import io.trading.analytics.indicator.Indicators;
import io.trading.analytics.indicator.MetricsComputer;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.TradeEvent;
import io.trading.analytics.sink.RecordSink;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the analytics state of one ingestion session: trade buffer, rolling history,
 * latest snapshots and alert rules.
 *
 * <p>{@link #onTrade} is called by the ingestion thread, {@link #flush} by the flush
 * timer. Queries and rule commands may be called from any thread at any time and see
 * the state before or after a flush, never part of one.
 */
public class AnalyticsEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsEngine.class);

    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final int DEFAULT_ALERT_LIMIT = 100;

    private final long flushIntervalMs;
    private final WindowAggregator aggregator;
    private final HistoryStore historyStore;
    private final MetricsComputer metricsComputer;
    private final CorrelationClusterer clusterer = new CorrelationClusterer();
    private final AlertRuleStore ruleStore;
    private final AlertLog alertLog;
    private final AlertEvaluator alertEvaluator;
    private final RecordSink sink;
    private final Map<String, String> correlationPeers;
    // replaced wholesale once per flush, never mutated after publication
    private volatile Map<String, MetricsSnapshot> latestSnapshots = Map.of();
    private final ReentrantLock flushLock = new ReentrantLock();

    private final AtomicLong tradesReceived = new AtomicLong();
    private final AtomicLong windowsFlushed = new AtomicLong();
    private final AtomicLong alertsTriggered = new AtomicLong();

    private AnalyticsEngine(Builder builder) {
        this.flushIntervalMs = builder.flushIntervalMs;
        this.aggregator = new WindowAggregator(builder.clock);
        this.historyStore = new HistoryStore(builder.historyCapacity);
        this.metricsComputer = new MetricsComputer(builder.indicatorSettings);
        this.ruleStore = new AlertRuleStore(builder.clock);
        this.alertLog = new AlertLog(builder.alertLogCapacity);
        this.alertEvaluator = new AlertEvaluator(ruleStore, alertLog);
        this.sink = builder.sink;
        this.correlationPeers = Map.copyOf(builder.correlationPeers);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---- ingestion ----

    public void onTrade(TradeEvent event) {
        aggregator.add(event);
        tradesReceived.incrementAndGet();
    }

    /**
     * Flushes when the configured interval has elapsed.
     *
     * @return the snapshots produced, empty when no flush was due
     */
    public List<MetricsSnapshot> flushIfDue() {
        flushLock.lock();
        try {
            if (!aggregator.shouldFlush(flushIntervalMs)) {
                return List.of();
            }
            return flush();
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Drains the trade buffer into windows, appends them to history as one batch, then
     * computes snapshots, evaluates alerts and hands every record to the sink.
     *
     * @return one snapshot per instrument that traded in the interval
     */
    public List<MetricsSnapshot> flush() {
        flushLock.lock();
        try {
            List<AggregatedWindow> windows = aggregator.flush();
            if (windows.isEmpty()) {
                return List.of();
            }
            historyStore.appendAll(windows);

            List<MetricsSnapshot> snapshots = new ArrayList<>(windows.size());
            List<AlertEvent> alerts = new ArrayList<>();
            Map<String, MetricsSnapshot> nextSnapshots = new LinkedHashMap<>(latestSnapshots);
            for (AggregatedWindow window : windows) {
                Optional<HistorySnapshot> history = historyStore.snapshot(window.instrumentId());
                if (history.isEmpty()) {
                    continue;
                }
                Optional<HistorySnapshot> peer = Optional.ofNullable(correlationPeers.get(window.instrumentId()))
                    .flatMap(historyStore::snapshot);

                MetricsSnapshot snapshot = metricsComputer.compute(history.get(), peer, window.timestamp());
                nextSnapshots.put(snapshot.instrumentId(), snapshot);
                snapshots.add(snapshot);
                alerts.addAll(alertEvaluator.evaluate(snapshot));
            }
            latestSnapshots = Collections.unmodifiableMap(nextSnapshots);

            windowsFlushed.addAndGet(windows.size());
            alertsTriggered.addAndGet(alerts.size());
            publish(windows, snapshots, alerts);

            LOGGER.debug("Flushed {} windows, {} snapshots, {} alerts", windows.size(), snapshots.size(), alerts.size());
            return snapshots;
        } finally {
            flushLock.unlock();
        }
    }

    private void publish(List<AggregatedWindow> windows, List<MetricsSnapshot> snapshots, List<AlertEvent> alerts) {
        for (AggregatedWindow window : windows) {
            try {
                sink.onWindow(window);
            } catch (RuntimeException e) {
                LOGGER.error("Sink failed for window {}", window.instrumentId(), e);
            }
        }
        for (MetricsSnapshot snapshot : snapshots) {
            try {
                sink.onMetrics(snapshot);
            } catch (RuntimeException e) {
                LOGGER.error("Sink failed for metrics {}", snapshot.instrumentId(), e);
            }
        }
        for (AlertEvent alert : alerts) {
            try {
                sink.onAlert(alert);
            } catch (RuntimeException e) {
                LOGGER.error("Sink failed for alert {}", alert.ruleId(), e);
            }
        }
    }

    // ---- queries ----

    public Optional<MetricsSnapshot> latestSnapshot(String instrumentId) {
        return Optional.ofNullable(latestSnapshots.get(instrumentId));
    }

    /**
     * Gets the latest snapshot of every tracked instrument, in first-seen order.
     * All entries come from the same completed flush.
     */
    public Map<String, MetricsSnapshot> latestSnapshots() {
        return latestSnapshots;
    }

    public double[] priceHistory(String instrumentId) {
        return priceHistory(instrumentId, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Gets up to {@code limit} most recent window prices, oldest first.
     */
    public double[] priceHistory(String instrumentId, int limit) {
        if (limit <= 0) {
            return new double[0];
        }
        return historyStore.recentPrices(instrumentId, limit);
    }

    /**
     * Correlation of every instrument pair with equal-length histories, keyed
     * {@code "A-B"} in first-seen order. Undefined correlations are omitted.
     */
    public Map<String, Double> correlationMap() {
        List<HistorySnapshot> histories = historyStore.snapshotAll();
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < histories.size(); i++) {
            for (int j = i + 1; j < histories.size(); j++) {
                HistorySnapshot a = histories.get(i);
                HistorySnapshot b = histories.get(j);
                if (a.size() != b.size()) {
                    continue;
                }
                OptionalDouble correlation = Indicators.correlation(a.prices(), b.prices());
                if (correlation.isPresent()) {
                    result.put(a.instrumentId() + "-" + b.instrumentId(), correlation.getAsDouble());
                }
            }
        }
        return result;
    }

    public Map<String, List<String>> clusters() {
        return clusters(CorrelationClusterer.DEFAULT_MIN_CORRELATION);
    }

    public Map<String, List<String>> clusters(double minCorrelation) {
        Map<String, double[]> prices = new LinkedHashMap<>();
        for (HistorySnapshot history : historyStore.snapshotAll()) {
            prices.put(history.instrumentId(), history.prices());
        }
        return clusterer.namedClusters(prices, minCorrelation);
    }

    public BacktestResult backtest(String instrumentId) {
        return backtest(instrumentId, BacktestSettings.DEFAULTS);
    }

    public BacktestResult backtest(String instrumentId, BacktestSettings settings) {
        double[] prices = historyStore.recentPrices(instrumentId, historyStore.capacity());
        return new MeanReversionBacktester(settings).run(instrumentId, prices);
    }

    public double[] anomalies(String instrumentId) {
        return anomalies(instrumentId, metricsComputer.getSettings().anomalyZThreshold());
    }

    /**
     * Gets the historical prices whose z-score against the full history exceeds the
     * threshold in absolute value.
     */
    public double[] anomalies(String instrumentId, double zThreshold) {
        double[] prices = historyStore.recentPrices(instrumentId, historyStore.capacity());
        return metricsComputer.anomalies(prices, zThreshold);
    }

    public List<AlertEvent> recentAlerts() {
        return recentAlerts(DEFAULT_ALERT_LIMIT);
    }

    public List<AlertEvent> recentAlerts(int limit) {
        return alertLog.recent(limit);
    }

    public List<String> trackedInstruments() {
        return historyStore.instruments();
    }

    public int historySize(String instrumentId) {
        return historyStore.size(instrumentId);
    }

    // ---- alert rule commands ----

    public AlertRule createRule(String instrumentId, String metricName, String condition, double threshold) {
        AlertRule rule = ruleStore.create(instrumentId, metricName, condition, threshold);
        LOGGER.info("Created alert rule {}", rule);
        return rule;
    }

    public AlertRule updateRule(String ruleId, String instrumentId, String metricName, String condition, double threshold) {
        AlertRule rule = ruleStore.update(ruleId, instrumentId, metricName, condition, threshold);
        LOGGER.info("Updated alert rule {}", rule);
        return rule;
    }

    public AlertRule setRuleEnabled(String ruleId, boolean enabled) {
        return ruleStore.setEnabled(ruleId, enabled);
    }

    public void deleteRule(String ruleId) {
        ruleStore.delete(ruleId);
        LOGGER.info("Deleted alert rule {}", ruleId);
    }

    public Optional<AlertRule> rule(String ruleId) {
        return ruleStore.get(ruleId);
    }

    public List<AlertRule> rules() {
        return ruleStore.list();
    }

    // ---- stats ----

    public long getTradesReceived() {
        return tradesReceived.get();
    }

    public long getWindowsFlushed() {
        return windowsFlushed.get();
    }

    public long getAlertsTriggered() {
        return alertsTriggered.get();
    }

    public int getPendingTrades() {
        return aggregator.pendingTrades();
    }

    public long getLastFlushTime() {
        return aggregator.getLastFlushTime();
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public static class Builder {
        private EpochClock clock = SystemEpochClock.INSTANCE;
        private long flushIntervalMs = WindowAggregator.DEFAULT_FLUSH_INTERVAL_MS;
        private int historyCapacity = HistoryStore.DEFAULT_CAPACITY;
        private int alertLogCapacity = AlertLog.DEFAULT_CAPACITY;
        private IndicatorSettings indicatorSettings = IndicatorSettings.DEFAULTS;
        private RecordSink sink = RecordSink.NOOP;
        private final Map<String, String> correlationPeers = new HashMap<>();

        public Builder clock(EpochClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
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

        public Builder indicatorSettings(IndicatorSettings indicatorSettings) {
            this.indicatorSettings = indicatorSettings;
            return this;
        }

        public Builder sink(RecordSink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Correlates the two instruments with each other in every snapshot.
         */
        public Builder correlate(String first, String second) {
            correlationPeers.put(first, second);
            correlationPeers.put(second, first);
            return this;
        }

        public AnalyticsEngine build() {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            if (sink == null) {
                throw new IllegalArgumentException("sink cannot be null");
            }
            if (flushIntervalMs <= 0) {
                throw new IllegalArgumentException("flushIntervalMs must be positive");
            }
            return new AnalyticsEngine(this);
        }
    }
}
