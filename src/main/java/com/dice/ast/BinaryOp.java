package com.dice.ast;

import java.util.Objects;

/**
 * Arithmetic over two sub-expressions.
 *
 * @param operator Arithmetic operator
 * @param left     Left operand, evaluated first
 * @param right    Right operand
 */
public record BinaryOp(ArithmeticOperator operator, DiceNode left, DiceNode right) implements DiceNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toNotation() {
        return left.toNotation() + " " + operator.symbol() + " " + right.toNotation();
    }
}
