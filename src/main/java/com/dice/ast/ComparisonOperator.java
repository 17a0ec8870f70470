package com.dice.ast;

/**
 * Comparison operators used by conditional and reroll dice.
 * {@code =} and {@code ==} behave identically; both are kept so notation round-trips.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    EQUAL("="),
    DOUBLE_EQUAL("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(long value, long threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case GREATER_THAN_OR_EQUALS -> value >= threshold;
            case LESS_THAN -> value < threshold;
            case LESS_THAN_OR_EQUALS -> value <= threshold;
            case EQUAL, DOUBLE_EQUAL -> value == threshold;
        };
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
