package com.dice.exception;

/**
 * Base exception for the dice expression engine.
 */
public class DiceException extends RuntimeException {

    public DiceException(String message) {
        super(message);
    }

    public DiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
