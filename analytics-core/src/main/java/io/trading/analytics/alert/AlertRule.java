package io.trading.analytics.alert;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Threshold rule over one metric of one instrument.
 *
 * <p>The definition is immutable; edits produce a new instance through
 * {@link #withDefinition} or {@link #withEnabled} that shares the trigger counter, so
 * the count survives updates.
 */
public final class AlertRule {

    private final String id;
    private final String instrumentId;
    private final String metricName;
    private final Condition condition;
    private final double threshold;
    private final boolean enabled;
    private final long createdAt;
    private final AtomicLong triggeredCount;

    public AlertRule(String id, String instrumentId, String metricName, Condition condition,
                     double threshold, boolean enabled, long createdAt) {
        this(id, instrumentId, metricName, condition, threshold, enabled, createdAt, new AtomicLong());
    }

    private AlertRule(String id, String instrumentId, String metricName, Condition condition,
                      double threshold, boolean enabled, long createdAt, AtomicLong triggeredCount) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName cannot be null or empty");
        }
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("threshold must be finite");
        }
        this.id = id;
        this.instrumentId = instrumentId;
        this.metricName = metricName;
        this.condition = condition;
        this.threshold = threshold;
        this.enabled = enabled;
        this.createdAt = createdAt;
        this.triggeredCount = triggeredCount;
    }

    public AlertRule withDefinition(String instrumentId, String metricName, Condition condition, double threshold) {
        return new AlertRule(id, instrumentId, metricName, condition, threshold, enabled, createdAt, triggeredCount);
    }

    public AlertRule withEnabled(boolean enabled) {
        return new AlertRule(id, instrumentId, metricName, condition, threshold, enabled, createdAt, triggeredCount);
    }

    long recordTrigger() {
        return triggeredCount.incrementAndGet();
    }

    public String getId() {
        return id;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public String getMetricName() {
        return metricName;
    }

    public Condition getCondition() {
        return condition;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getTriggeredCount() {
        return triggeredCount.get();
    }

    @Override
    public String toString() {
        return "AlertRule{" +
            "id='" + id + '\'' +
            ", instrumentId='" + instrumentId + '\'' +
            ", metric='" + metricName + '\'' +
            ", condition=" + condition.getSymbol() +
            ", threshold=" + threshold +
            ", enabled=" + enabled +
            ", triggeredCount=" + triggeredCount.get() +
            '}';
    }
}
