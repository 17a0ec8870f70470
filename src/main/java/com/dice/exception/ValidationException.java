package com.dice.exception;

/**
 * Exception thrown for input that is well-formed but outside accepted limits,
 * such as an over-long expression or a die with zero sides.
 */
public class ValidationException extends DiceException {

    private final int position;

    public ValidationException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
