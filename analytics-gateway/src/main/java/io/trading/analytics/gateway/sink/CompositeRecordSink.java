package io.trading.analytics.gateway.sink;

import io.trading.analytics.gateway.metrics.GatewayMetrics;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.sink.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fans records out to several named sinks. A sink that throws is logged and counted;
 * the remaining sinks still receive the record.
 */
public class CompositeRecordSink implements RecordSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeRecordSink.class);

    private final Map<String, RecordSink> sinks;
    private final GatewayMetrics metrics;

    /**
     * @param sinks   Sinks by name, called in iteration order
     * @param metrics Failure counter, may be null
     */
    public CompositeRecordSink(Map<String, RecordSink> sinks, GatewayMetrics metrics) {
        this.sinks = new LinkedHashMap<>(sinks);
        this.metrics = metrics;
    }

    @Override
    public void onWindow(AggregatedWindow window) {
        dispatch("window", sink -> sink.onWindow(window));
    }

    @Override
    public void onMetrics(MetricsSnapshot snapshot) {
        dispatch("metrics", sink -> sink.onMetrics(snapshot));
    }

    @Override
    public void onAlert(AlertEvent event) {
        dispatch("alert", sink -> sink.onAlert(event));
    }

    private void dispatch(String recordType, Consumer<RecordSink> action) {
        for (Map.Entry<String, RecordSink> entry : sinks.entrySet()) {
            try {
                action.accept(entry.getValue());
            } catch (RuntimeException e) {
                LOGGER.error("Sink {} failed to publish {} record", entry.getKey(), recordType, e);
                if (metrics != null) {
                    metrics.recordPublicationFailure(entry.getKey());
                }
            }
        }
    }

    public int size() {
        return sinks.size();
    }
}
