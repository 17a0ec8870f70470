package com.dice.exception;

/**
 * Exception thrown when a single die keeps meeting its reroll condition
 * after the configured number of rerolls.
 */
public class MaxRerollsExceededException extends EvaluationException {

    private final int limit;

    public MaxRerollsExceededException(int limit, String notation) {
        super("Maximum rerolls exceeded (" + limit + ") while rolling " + notation);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
