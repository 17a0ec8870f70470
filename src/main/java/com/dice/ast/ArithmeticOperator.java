package com.dice.ast;

/**
 * Binary arithmetic operators, in the order they appear in the grammar.
 */
public enum ArithmeticOperator {
    PLUS('+', "addition"),
    MINUS('-', "subtraction"),
    MULTIPLY('*', "multiplication"),
    DIVIDE('/', "division");

    private final char symbol;
    private final String displayName;

    ArithmeticOperator(char symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }

    public char symbol() {
        return symbol;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True for {@code *} and {@code /}, which bind tighter than {@code +} and {@code -}.
     */
    public boolean isMultiplicative() {
        return this == MULTIPLY || this == DIVIDE;
    }

    public static ArithmeticOperator fromSymbol(char symbol) {
        for (ArithmeticOperator operator : values()) {
            if (operator.symbol == symbol) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown arithmetic operator: " + symbol);
    }
}
