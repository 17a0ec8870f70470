package com.dice.ast;

import java.util.Objects;

/**
 * Success-counting roll, e.g. {@code 4d6>3}: the result is the number of dice
 * whose face satisfies the comparison.
 *
 * @param count     Number of dice
 * @param sides     Faces per die
 * @param operator  Comparison applied to each die
 * @param threshold Right-hand side of the comparison
 */
public record ConditionalDice(int count, int sides, ComparisonOperator operator, int threshold)
        implements DiceNode {

    public ConditionalDice {
        DiceShape.validate(count, sides);
        Objects.requireNonNull(operator, "operator");
    }

    /**
     * Check whether a single die counts as a success.
     */
    public boolean isSuccess(int face) {
        return operator.test(face, threshold);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String toNotation() {
        return count + "d" + sides + operator.symbol() + threshold;
    }
}
