package io.trading.analytics.model;

/**
 * Record of one alert rule matching a metrics snapshot.
 *
 * @param ruleId       Identifier of the rule that fired
 * @param timestamp    Evaluation time in milliseconds since epoch
 * @param instrumentId Instrument symbol
 * @param metricName   Metric the rule watches
 * @param actualValue  Observed metric value
 * @param threshold    Rule threshold
 */
public record AlertEvent(
    String ruleId,
    long timestamp,
    String instrumentId,
    String metricName,
    double actualValue,
    double threshold
) {
    public AlertEvent {
        if (ruleId == null || ruleId.isEmpty()) {
            throw new IllegalArgumentException("ruleId cannot be null or empty");
        }
        if (instrumentId == null || instrumentId.isEmpty()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
    }
}
