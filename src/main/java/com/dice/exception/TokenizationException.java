package com.dice.exception;

/**
 * Exception thrown when part of an expression matches no token pattern.
 */
public class TokenizationException extends DiceException {

    private final int position;
    private final String fragment;

    public TokenizationException(String message, int position, String fragment) {
        super(message);
        this.position = position;
        this.fragment = fragment;
    }

    /**
     * Position of the first unmatched character in the whitespace-stripped expression.
     */
    public int getPosition() {
        return position;
    }

    /**
     * The unmatched remainder of the expression, starting at {@link #getPosition()}.
     */
    public String getFragment() {
        return fragment;
    }
}
