package io.trading.analytics.alert;

import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Alert rules keyed by generated id. Each command replaces the rule atomically, so an
 * evaluation sees a rule either before or after the change.
 */
public class AlertRuleStore {

    private final EpochClock clock;
    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public AlertRuleStore() {
        this(SystemEpochClock.INSTANCE);
    }

    public AlertRuleStore(EpochClock clock) {
        this.clock = clock;
    }

    /**
     * Creates an enabled rule.
     *
     * @throws IllegalArgumentException if the instrument is blank, the metric or condition
     *                                  is unknown, or the threshold is not finite
     */
    public AlertRule create(String instrumentId, String metricName, String condition, double threshold) {
        AlertRule rule = new AlertRule(
            UUID.randomUUID().toString(),
            normalizeInstrument(instrumentId),
            validateMetric(metricName),
            Condition.fromSymbol(condition),
            threshold,
            true,
            clock.time()
        );

        lock.writeLock().lock();
        try {
            rules.put(rule.getId(), rule);
        } finally {
            lock.writeLock().unlock();
        }
        return rule;
    }

    /**
     * Replaces the definition of an existing rule; enabled flag and trigger count are kept.
     */
    public AlertRule update(String ruleId, String instrumentId, String metricName, String condition, double threshold) {
        String instrument = normalizeInstrument(instrumentId);
        String metric = validateMetric(metricName);
        Condition parsed = Condition.fromSymbol(condition);
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("threshold must be finite");
        }

        lock.writeLock().lock();
        try {
            AlertRule updated = require(ruleId).withDefinition(instrument, metric, parsed, threshold);
            rules.put(ruleId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AlertRule setEnabled(String ruleId, boolean enabled) {
        lock.writeLock().lock();
        try {
            AlertRule updated = require(ruleId).withEnabled(enabled);
            rules.put(ruleId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String ruleId) {
        lock.writeLock().lock();
        try {
            if (rules.remove(ruleId) == null) {
                throw new UnknownRuleException(ruleId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AlertRule> get(String ruleId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(ruleId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets all rules in creation order.
     */
    public List<AlertRule> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the enabled rules watching the given instrument.
     */
    public List<AlertRule> activeRulesFor(String instrumentId) {
        lock.readLock().lock();
        try {
            List<AlertRule> result = new ArrayList<>();
            for (AlertRule rule : rules.values()) {
                if (rule.isEnabled() && rule.getInstrumentId().equals(instrumentId)) {
                    result.add(rule);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rules.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private AlertRule require(String ruleId) {
        AlertRule rule = rules.get(ruleId);
        if (rule == null) {
            throw new UnknownRuleException(ruleId);
        }
        return rule;
    }

    private static String normalizeInstrument(String instrumentId) {
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new IllegalArgumentException("instrumentId cannot be null or empty");
        }
        return instrumentId.trim().toUpperCase(Locale.ROOT);
    }

    private static String validateMetric(String metricName) {
        return AlertMetric.lookup(metricName)
            .map(metric -> metricName.trim().toLowerCase(Locale.ROOT))
            .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metricName));
    }
}
