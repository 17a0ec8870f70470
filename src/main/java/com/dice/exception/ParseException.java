package com.dice.exception;

/**
 * Exception thrown when a token sequence violates the expression grammar.
 */
public class ParseException extends DiceException {

    private final int position;
    private final String token;

    public ParseException(String message, int position, String token) {
        super(message);
        this.position = position;
        this.token = token;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Text of the offending token, or null when the error is at the end of input.
     */
    public String getToken() {
        return token;
    }
}
