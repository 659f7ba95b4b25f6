package io.trading.analytics.alert;

/**
 * Thrown when a command names an alert rule id that does not exist.
 */
public class UnknownRuleException extends RuntimeException {

    private final String ruleId;

    public UnknownRuleException(String ruleId) {
        super("Unknown alert rule: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
