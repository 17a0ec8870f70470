package com.dice.exception;

/**
 * Exception thrown while evaluating a parsed expression.
 */
public class EvaluationException extends DiceException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
