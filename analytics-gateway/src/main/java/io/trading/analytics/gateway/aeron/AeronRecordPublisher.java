package io.trading.analytics.gateway.aeron;

import io.aeron.Aeron;
import io.aeron.ExclusivePublication;
import io.aeron.Publication;
import io.trading.analytics.gateway.core.ProcessingTimer;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.sink.RecordSink;
import org.agrona.CloseHelper;
import org.agrona.concurrent.AtomicBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes flushed records on Aeron IPC streams using {@link RecordEncoder}.
 *
 * <p>Called only from the flush thread, so one reusable buffer per record type is enough.
 * A rejected offer is counted and the record dropped; the flush path never retries.
 * Offers made while no subscriber is attached are counted separately.
 */
public class AeronRecordPublisher implements RecordSink, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AeronRecordPublisher.class);
    private static final int BACKPRESSURE_LOG_INTERVAL = 1000;

    private final Aeron aeron;
    private final ProcessingTimer processingTimer;
    private final Map<RecordType, ExclusivePublication> publications = new EnumMap<>(RecordType.class);
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong notConnected = new AtomicLong();
    private final AtomicLong published = new AtomicLong();

    private final AtomicBuffer windowBuffer = RecordEncoder.newWindowBuffer();
    private final AtomicBuffer metricsBuffer = RecordEncoder.newMetricsBuffer();
    private final AtomicBuffer alertBuffer = RecordEncoder.newAlertBuffer();

    public AeronRecordPublisher(Aeron aeron, ProcessingTimer processingTimer) {
        this.aeron = aeron;
        this.processingTimer = processingTimer;
    }

    @Override
    public void onWindow(AggregatedWindow window) {
        ProcessingTimer.TimingContext timer = processingTimer.start();
        int length = RecordEncoder.encodeWindow(windowBuffer, window);
        offer(RecordType.WINDOW, windowBuffer, length, timer);
    }

    @Override
    public void onMetrics(MetricsSnapshot snapshot) {
        ProcessingTimer.TimingContext timer = processingTimer.start();
        int length = RecordEncoder.encodeMetrics(metricsBuffer, snapshot);
        offer(RecordType.METRICS, metricsBuffer, length, timer);
    }

    @Override
    public void onAlert(AlertEvent event) {
        ProcessingTimer.TimingContext timer = processingTimer.start();
        int length = RecordEncoder.encodeAlert(alertBuffer, event);
        offer(RecordType.ALERT, alertBuffer, length, timer);
    }

    private boolean offer(RecordType type, AtomicBuffer buffer, int length, ProcessingTimer.TimingContext timer) {
        long result = getOrCreatePublication(type).offer(buffer, 0, length);
        if (result < 0) {
            handleRejected(type, result);
            return false;
        }
        published.incrementAndGet();
        processingTimer.record("aeron", type.getDisplayName(), timer.stop());
        return true;
    }

    private synchronized ExclusivePublication getOrCreatePublication(RecordType type) {
        return publications.computeIfAbsent(type, t -> {
            String channel = StreamRegistry.getChannel(t);
            int streamId = StreamRegistry.getStreamId(t);
            LOGGER.info("Creating Aeron publication: channel={}, streamId={}", channel, streamId);
            return aeron.addExclusivePublication(channel, streamId);
        });
    }

    private void handleRejected(RecordType type, long result) {
        if (result == Publication.NOT_CONNECTED) {
            notConnected.incrementAndGet();
            return;
        }
        long failures = publishFailures.incrementAndGet();
        if (failures % BACKPRESSURE_LOG_INTERVAL == 1) {
            LOGGER.warn("Aeron publication of {} rejected (count: {}, code: {})", type, failures, result);
        }
    }

    public long getPublishFailureCount() {
        return publishFailures.get();
    }

    public long getNotConnectedCount() {
        return notConnected.get();
    }

    public long getPublishedCount() {
        return published.get();
    }

    public synchronized int getPublicationCount() {
        return publications.size();
    }

    @Override
    public synchronized void close() {
        publications.values().forEach(CloseHelper::quietClose);
        publications.clear();
    }
}
