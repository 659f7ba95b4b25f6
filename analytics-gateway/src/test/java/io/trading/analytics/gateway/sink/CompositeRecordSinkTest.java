package io.trading.analytics.gateway.sink;

import io.prometheus.client.CollectorRegistry;
import io.trading.analytics.gateway.metrics.GatewayMetrics;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.sink.RecordSink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompositeRecordSinkTest {

    @Test
    void testFailingSinkDoesNotStopOthers() {
        GatewayMetrics metrics = new GatewayMetrics(new CollectorRegistry());
        List<Object> received = new ArrayList<>();

        Map<String, RecordSink> sinks = new LinkedHashMap<>();
        sinks.put("broken", new RecordSink() {
            @Override
            public void onWindow(AggregatedWindow window) {
                throw new IllegalStateException("down");
            }

            @Override
            public void onMetrics(MetricsSnapshot snapshot) {
                throw new IllegalStateException("down");
            }

            @Override
            public void onAlert(AlertEvent event) {
                throw new IllegalStateException("down");
            }
        });
        sinks.put("recording", new RecordSink() {
            @Override
            public void onWindow(AggregatedWindow window) {
                received.add(window);
            }

            @Override
            public void onMetrics(MetricsSnapshot snapshot) {
                received.add(snapshot);
            }

            @Override
            public void onAlert(AlertEvent event) {
                received.add(event);
            }
        });

        CompositeRecordSink composite = new CompositeRecordSink(sinks, metrics);
        AggregatedWindow window = new AggregatedWindow(1L, "BTCUSDT", 100, 0, 100, 100, 1, 1, 100);
        AlertEvent alert = new AlertEvent("rule-1", 1L, "BTCUSDT", "z_score", 3.0, 2.0);

        composite.onWindow(window);
        composite.onAlert(alert);

        assertEquals(List.of(window, alert), received);
        assertEquals(2.0, metrics.getPublicationFailures("broken"));
        assertEquals(0.0, metrics.getPublicationFailures("recording"));
        assertEquals(2, composite.size());
    }
}
