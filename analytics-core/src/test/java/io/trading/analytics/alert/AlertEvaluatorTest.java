package io.trading.analytics.alert;

import io.trading.analytics.model.AlertEvent;
import io.trading.analytics.model.MetricsSnapshot;
import io.trading.analytics.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AlertEvaluatorTest {

    private AlertRuleStore store;
    private AlertLog log;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new AlertRuleStore();
        log = new AlertLog(3);
        evaluator = new AlertEvaluator(store, log);
    }

    @Test
    void testMatchingRuleFires() {
        AlertRule rule = store.create("X", "z_score", ">", 2.0);

        List<AlertEvent> events = evaluator.evaluate(snapshot("X", 3.1, 100.0));

        assertEquals(1, events.size());
        AlertEvent event = events.get(0);
        assertEquals(rule.getId(), event.ruleId());
        assertEquals("X", event.instrumentId());
        assertEquals("z_score", event.metricName());
        assertEquals(3.1, event.actualValue());
        assertEquals(2.0, event.threshold());
        assertEquals(1, store.get(rule.getId()).orElseThrow().getTriggeredCount());
        assertEquals(1, log.size());
    }

    @Test
    void testNonMatchingRulesAreSilent() {
        store.create("X", "z_score", ">", 2.0);
        store.create("Y", "z_score", ">", 0.0);
        AlertRule disabled = store.create("X", "z_score", ">", 0.0);
        store.setEnabled(disabled.getId(), false);

        assertTrue(evaluator.evaluate(snapshot("X", 1.5, 100.0)).isEmpty());
        assertEquals(0, log.size());
        assertEquals(0, store.get(disabled.getId()).orElseThrow().getTriggeredCount());
    }

    @Test
    void testAliasResolvesToSameField() {
        store.create("X", "price", ">=", 100.0);
        store.create("X", "mean_price", "==", 100.0000001);

        assertEquals(2, evaluator.evaluate(snapshot("X", 0.0, 100.0)).size());
    }

    @Test
    void testLogDropsOldest() {
        AlertRule rule = store.create("X", "z_score", ">", 0.0);
        for (int i = 1; i <= 5; i++) {
            evaluator.evaluate(snapshot("X", i, 100.0));
        }

        assertEquals(5, store.get(rule.getId()).orElseThrow().getTriggeredCount());
        List<AlertEvent> recent = log.recent(10);
        assertEquals(3, recent.size());
        assertEquals(3.0, recent.get(0).actualValue());
        assertEquals(5.0, recent.get(2).actualValue());

        List<AlertEvent> lastTwo = log.recent(2);
        assertEquals(4.0, lastTwo.get(0).actualValue());
        assertEquals(5.0, lastTwo.get(1).actualValue());
    }

    static MetricsSnapshot snapshot(String instrumentId, double zScore, double meanPrice) {
        return new MetricsSnapshot(
            1_000L, instrumentId, meanPrice, 1.0, 0.01, zScore, meanPrice, meanPrice, 50.0,
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), Trend.NEUTRAL
        );
    }
}
