package com.dice.ast;

/**
 * Integer constant.
 *
 * @param value Constant value
 */
public record NumberLiteral(long value) implements DiceNode {

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toNotation() {
        return Long.toString(value);
    }
}
