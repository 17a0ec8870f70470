package com.dice.expression;

/**
 * Represents a token in a dice expression.
 *
 * @param type     Token type
 * @param text     Matched text; concatenating all token texts rebuilds the stripped expression
 * @param literal  Parsed payload: a {@code Long} for numbers, an {@code ArithmeticOperator}
 *                 for operators, the dice node for dice tokens, null otherwise
 * @param position Offset in the whitespace-stripped expression
 */
public record Token(TokenType type, String text, Object literal, int position) {

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
