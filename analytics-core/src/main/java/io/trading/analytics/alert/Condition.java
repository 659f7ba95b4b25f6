package io.trading.analytics.alert;

/**
 * Comparator applied between an observed metric value and a rule threshold.
 * Equality comparisons tolerate an absolute difference below {@link #EPSILON}.
 */
public enum Condition {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    public static final double EPSILON = 1e-6;

    private final String symbol;

    Condition(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        return switch (this) {
            case GREATER_THAN -> actual > threshold;
            case LESS_THAN -> actual < threshold;
            case GREATER_OR_EQUAL -> actual >= threshold;
            case LESS_OR_EQUAL -> actual <= threshold;
            case EQUAL -> Math.abs(actual - threshold) < EPSILON;
            case NOT_EQUAL -> Math.abs(actual - threshold) >= EPSILON;
        };
    }

    public static Condition fromSymbol(String symbol) {
        if (symbol != null) {
            String trimmed = symbol.trim();
            for (Condition condition : values()) {
                if (condition.symbol.equals(trimmed)) {
                    return condition;
                }
            }
        }
        throw new IllegalArgumentException("Unknown condition: " + symbol);
    }
}
