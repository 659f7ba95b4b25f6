package io.trading.analytics.gateway.core;

import io.aeron.Aeron;
import io.aeron.driver.MediaDriver;
import io.aeron.driver.ThreadingMode;
import io.trading.analytics.engine.AnalyticsEngine;
import io.trading.analytics.gateway.aeron.AeronRecordPublisher;
import io.trading.analytics.gateway.config.CorrelationPair;
import io.trading.analytics.gateway.config.FeedConfig;
import io.trading.analytics.gateway.config.GatewayConfig;
import io.trading.analytics.gateway.config.SinkType;
import io.trading.analytics.gateway.feed.BackoffPolicy;
import io.trading.analytics.gateway.feed.FeedClient;
import io.trading.analytics.gateway.feed.FeedConnector;
import io.trading.analytics.gateway.feed.FeedState;
import io.trading.analytics.gateway.feed.NettyFeedConnector;
import io.trading.analytics.gateway.metrics.GatewayMetrics;
import io.trading.analytics.gateway.metrics.MetricsServer;
import io.trading.analytics.gateway.sink.CompositeRecordSink;
import io.trading.analytics.gateway.sink.LoggingRecordSink;
import io.trading.analytics.parser.BinanceTradeParser;
import io.trading.analytics.sink.RecordSink;
import org.agrona.CloseHelper;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the analytics gateway together and owns its threads.
 *
 * <pre>
 * feed thread ──► TickChannel ──► ingestion worker ──► AnalyticsEngine
 *                                                        ▲
 *                              flush scheduler ──────────┘──► RecordSink(s)
 * </pre>
 */
public class AnalyticsController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsController.class);
    private static final String FEED_NAME = "binance-trades";

    private final GatewayConfig config;
    private final MediaDriver mediaDriver;
    private final Aeron aeron;
    private final AeronRecordPublisher aeronPublisher;
    private final GatewayMetrics metrics;
    private final ProcessingTimer processingTimer;
    private final AnalyticsEngine engine;
    private final TickChannel tickChannel;
    private final IngestionWorker ingestionWorker;
    private final FeedClient feedClient;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final ShutdownSignalBarrier shutdownBarrier;
    private final ScheduledExecutorService scheduler;
    private Thread feedThread;

    public AnalyticsController(GatewayConfig config) {
        this(config, new GatewayMetrics(), new NettyFeedConnector(FEED_NAME, config.feed().enableCompression()),
            SystemEpochClock.INSTANCE);
    }

    public AnalyticsController(GatewayConfig config, GatewayMetrics metrics, FeedConnector connector, EpochClock clock) {
        this.config = config;
        this.metrics = metrics;
        this.processingTimer = new ProcessingTimer();

        if (config.sinks().contains(SinkType.AERON)) {
            String aeronDir = resolveAeronDir(config);
            MediaDriver.Context mediaDriverContext = new MediaDriver.Context()
                .aeronDirectoryName(aeronDir)
                .threadingMode(ThreadingMode.SHARED)
                .dirDeleteOnStart(true)
                .dirDeleteOnShutdown(true);
            this.mediaDriver = MediaDriver.launchEmbedded(mediaDriverContext);
            LOGGER.info("Media driver started: dir={}", mediaDriver.aeronDirectoryName());

            this.aeron = Aeron.connect(new Aeron.Context()
                .aeronDirectoryName(mediaDriver.aeronDirectoryName())
                .useConductorAgentInvoker(true));
            this.aeronPublisher = new AeronRecordPublisher(aeron, processingTimer);
        } else {
            this.mediaDriver = null;
            this.aeron = null;
            this.aeronPublisher = null;
        }

        AnalyticsEngine.Builder engineBuilder = AnalyticsEngine.builder()
            .clock(clock)
            .flushIntervalMs(config.flushIntervalMs())
            .historyCapacity(config.historyCapacity())
            .alertLogCapacity(config.alertLogCapacity())
            .sink(createSink());
        for (CorrelationPair pair : config.correlationPairs()) {
            engineBuilder.correlate(pair.first(), pair.second());
        }
        this.engine = engineBuilder.build();

        this.tickChannel = new TickChannel(config.tickQueueCapacity(), metrics::recordTickDropped);
        this.ingestionWorker = new IngestionWorker(tickChannel, engine);

        FeedConfig feed = config.feed();
        this.feedClient = new FeedClient(
            FEED_NAME,
            feed,
            connector,
            new BinanceTradeParser(clock),
            tickChannel::offer,
            new BackoffPolicy(feed.backoffBaseMs(), feed.backoffMaxMs(), feed.backoffJitterMs()),
            clock,
            metrics,
            processingTimer
        );

        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), Math.max(config.flushIntervalMs(), 60_000L), clock);
        this.healthMonitor.registerFeed(FEED_NAME, feedClient::status);
        this.metricsServer = new MetricsServer(config.metricsPort(), config.gatewayId(), metrics, feedClient, engine, tickChannel);
        this.shutdownBarrier = new ShutdownSignalBarrier();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "flush-scheduler");
            thread.setDaemon(true);
            return thread;
        });

        LOGGER.info("Analytics controller initialized: {}", config.gatewayId());
    }

    private RecordSink createSink() {
        Map<String, RecordSink> sinks = new LinkedHashMap<>();
        if (config.sinks().contains(SinkType.LOG)) {
            sinks.put(SinkType.LOG.getConfigName(), new LoggingRecordSink());
        }
        if (aeronPublisher != null) {
            sinks.put(SinkType.AERON.getConfigName(), aeronPublisher);
        }
        return new CompositeRecordSink(sinks, metrics);
    }

    /**
     * Falls back to the temp directory when /dev/shm is not available (e.g. on macOS).
     */
    private static String resolveAeronDir(GatewayConfig config) {
        String aeronDir = config.aeronDir();
        if (aeronDir.startsWith("/dev/shm") && !Files.exists(Paths.get("/dev/shm"))) {
            aeronDir = System.getProperty("java.io.tmpdir") + "/trade-analytics-" + config.gatewayId();
            LOGGER.info("Using temp directory for Aeron: {}", aeronDir);
        }
        try {
            Path dirPath = Paths.get(aeronDir);
            if (!Files.exists(dirPath)) {
                Files.createDirectories(dirPath);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not create Aeron directory: {}", aeronDir, e);
        }
        return aeronDir;
    }

    /**
     * Starts the worker, the flush scheduler, monitoring and the feed thread.
     */
    public void start() throws IOException {
        LOGGER.info("Starting Trade Analytics Gateway...");

        ingestionWorker.start();
        scheduler.scheduleAtFixedRate(this::flushIfDue, config.flushCheckMs(), config.flushCheckMs(), TimeUnit.MILLISECONDS);
        healthMonitor.start();
        metricsServer.start();

        feedThread = new Thread(this::runFeed, "feed-" + FEED_NAME);
        feedThread.setDaemon(true);
        feedThread.start();

        LOGGER.info("Trade Analytics Gateway started, subscribed to {}", config.feed().instruments());
        logStatus();
    }

    private void runFeed() {
        FeedState terminal = feedClient.connect();
        if (terminal == FeedState.FAILED) {
            LOGGER.error("Feed {} failed permanently; status endpoints stay up until shutdown", FEED_NAME);
        }
    }

    synchronized void flushIfDue() {
        try {
            long windowsBefore = engine.getWindowsFlushed();
            long alertsBefore = engine.getAlertsTriggered();
            ProcessingTimer.TimingContext timer = processingTimer.start();

            engine.flushIfDue();
            long windows = engine.getWindowsFlushed() - windowsBefore;
            if (windows == 0) {
                return;
            }

            long nanos = timer.stop();
            processingTimer.record("engine", "flush", nanos);
            metrics.recordFlush((int) windows, (int) (engine.getAlertsTriggered() - alertsBefore), nanos / 1_000_000.0);
            metrics.setTickQueueDepth(tickChannel.size());
        } catch (RuntimeException e) {
            LOGGER.error("Flush failed", e);
        }
    }

    public void waitForShutdown() {
        LOGGER.info("Gateway running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();
        LOGGER.info("Shutdown signal received");
    }

    public void shutdown() {
        LOGGER.info("Shutting down Trade Analytics Gateway...");

        feedClient.close();
        if (feedThread != null) {
            try {
                feedThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        CloseHelper.closeAll(ingestionWorker, healthMonitor, metricsServer, aeronPublisher);
        CloseHelper.close(aeron);
        CloseHelper.close(mediaDriver);

        logStatus();
        LOGGER.info("Trade Analytics Gateway shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    public void logStatus() {
        LOGGER.info("=== Gateway Status ===");
        LOGGER.info("Gateway ID: {}", config.gatewayId());
        LOGGER.info("Feed: {}", feedClient.status());
        LOGGER.info("Tick channel: depth={}, dropped={}, processed={}",
            tickChannel.size(), tickChannel.dropped(), ingestionWorker.processed());
        LOGGER.info("Engine: trades={}, windows={}, alerts={}, instruments={}",
            engine.getTradesReceived(), engine.getWindowsFlushed(), engine.getAlertsTriggered(),
            engine.trackedInstruments());
        if (aeronPublisher != null) {
            LOGGER.info("Aeron: publications={}, published={}, failures={}, notConnected={}",
                aeronPublisher.getPublicationCount(), aeronPublisher.getPublishedCount(),
                aeronPublisher.getPublishFailureCount(), aeronPublisher.getNotConnectedCount());
        }

        for (Map.Entry<ProcessingTimer.TimerKey, ProcessingTimer.TimerStats> entry :
             processingTimer.getAllStats().entrySet()) {
            ProcessingTimer.TimerStats stats = entry.getValue();
            if (stats.getCount() > 0) {
                LOGGER.info("  {}: count={}, avg={} us, min={} us, max={} us",
                    entry.getKey(),
                    stats.getCount(),
                    String.format("%.2f", stats.getAvgMicros()),
                    stats.getMinMicros(),
                    stats.getMaxMicros()
                );
            }
        }

        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }

    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public AnalyticsEngine getEngine() {
        return engine;
    }

    public FeedClient getFeedClient() {
        return feedClient;
    }

    public TickChannel getTickChannel() {
        return tickChannel;
    }
}
