package com.dice.ast;

import java.util.Objects;

/**
 * Parenthesized group. Evaluates to its inner expression.
 *
 * @param inner Grouped expression
 */
public record Parentheses(DiceNode inner) implements DiceNode {

    public Parentheses {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitParentheses(this);
    }

    @Override
    public String toNotation() {
        return "(" + inner.toNotation() + ")";
    }
}
