package io.trading.analytics.gateway.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.trading.analytics.model.AggregatedWindow;
import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.sink.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

/**
 * Writes every record as one JSON line on the {@code io.trading.analytics.records} logger.
 *
 * <pre>
 * {"type":"metrics","timestamp":1704067205000,"instrument_id":"BTCUSDT","mean_price":43250.5,...,"correlation":null}
 * </pre>
 */
public class LoggingRecordSink implements RecordSink {

    public static final String LOGGER_NAME = "io.trading.analytics.records";

    private static final Logger RECORDS = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper objectMapper;

    public LoggingRecordSink() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    @Override
    public void onWindow(AggregatedWindow window) {
        RECORDS.info(toJson("window", window));
    }

    @Override
    public void onMetrics(MetricsSnapshot snapshot) {
        RECORDS.info(toJson("metrics", snapshot));
    }

    @Override
    public void onAlert(AlertEvent event) {
        RECORDS.info(toJson("alert", event));
    }

    /**
     * Serializes a record with a leading {@code type} field.
     */
    String toJson(String type, Object record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type);
        node.setAll((ObjectNode) objectMapper.valueToTree(record));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + type + " record", e);
        }
    }
}
