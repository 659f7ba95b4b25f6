package io.trading.analytics.alert;

import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Matches fresh snapshots against the enabled rules of their instrument.
 */
public class AlertEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertEvaluator.class);

    private final AlertRuleStore ruleStore;
    private final AlertLog alertLog;

    public AlertEvaluator(AlertRuleStore ruleStore, AlertLog alertLog) {
        this.ruleStore = ruleStore;
        this.alertLog = alertLog;
    }

    /**
     * Evaluates every enabled rule for the snapshot's instrument. Rules whose metric cannot
     * be resolved are skipped. Each match bumps the rule's trigger count and appends an
     * event to the log.
     *
     * @return the events produced, possibly empty
     */
    public List<AlertEvent> evaluate(MetricsSnapshot snapshot) {
        List<AlertRule> rules = ruleStore.activeRulesFor(snapshot.instrumentId());
        if (rules.isEmpty()) {
            return List.of();
        }

        List<AlertEvent> events = new ArrayList<>();
        for (AlertRule rule : rules) {
            Optional<AlertMetric> metric = AlertMetric.lookup(rule.getMetricName());
            if (metric.isEmpty()) {
                continue;
            }
            OptionalDouble value = metric.get().resolve(snapshot);
            if (value.isEmpty() || !rule.getCondition().test(value.getAsDouble(), rule.getThreshold())) {
                continue;
            }

            long count = rule.recordTrigger();
            AlertEvent event = new AlertEvent(
                rule.getId(),
                snapshot.timestamp(),
                snapshot.instrumentId(),
                rule.getMetricName(),
                value.getAsDouble(),
                rule.getThreshold()
            );
            alertLog.append(event);
            events.add(event);

            LOGGER.warn("Alert triggered: {} {} {} {} (actual={}, rule={}, count={})",
                snapshot.instrumentId(), rule.getMetricName(), rule.getCondition().getSymbol(),
                rule.getThreshold(), value.getAsDouble(), rule.getId(), count);
        }
        return events;
    }
}
