package com.dice.ast;

import java.util.Objects;

/**
 * Roll with reroll mechanics, e.g. {@code 2d6r1}, {@code 4d6ro<2}, {@code 3d10rr>=9}.
 *
 * @param count      Number of dice
 * @param sides      Faces per die
 * @param rerollType How a matching face is handled
 * @param condition  Comparison that triggers a reroll
 * @param threshold  Right-hand side of the comparison
 */
public record RerollDice(int count, int sides, RerollType rerollType, ComparisonOperator condition, int threshold)
        implements DiceNode {

    public RerollDice {
        DiceShape.validate(count, sides);
        Objects.requireNonNull(rerollType, "rerollType");
        Objects.requireNonNull(condition, "condition");
    }

    /**
     * Check whether a face triggers another roll.
     */
    public boolean shouldReroll(int face) {
        return condition.test(face, threshold);
    }

    /**
     * Condition as written in notation, e.g. {@code "=1"} or {@code "<=2"}.
     */
    public String conditionText() {
        return condition.symbol() + threshold;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitReroll(this);
    }

    @Override
    public String toNotation() {
        String op = condition == ComparisonOperator.EQUAL ? "" : condition.symbol();
        return count + "d" + sides + "r" + rerollType.marker() + op + threshold;
    }
}
