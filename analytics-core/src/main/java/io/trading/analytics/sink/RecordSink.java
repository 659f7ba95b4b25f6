package io.trading.analytics.sink;

import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;

/**
 * Receives the records produced by each flush. Called on the flush thread; implementations
 * must not block for long and should not throw.
 */
public interface RecordSink {

    void onWindow(AggregatedWindow window);

    void onMetrics(MetricsSnapshot snapshot);

    void onAlert(AlertEvent event);

    RecordSink NOOP = new RecordSink() {
        @Override
        public void onWindow(AggregatedWindow window) {
        }

        @Override
        public void onMetrics(MetricsSnapshot snapshot) {
        }

        @Override
        public void onAlert(AlertEvent event) {
        }
    };
}
