package com.dice.ast;

/**
 * Plain dice roll, e.g. {@code 3d6}: roll {@code count} dice and sum them.
 *
 * @param count Number of dice
 * @param sides Faces per die
 */
public record DiceRoll(int count, int sides) implements DiceNode {

    public DiceRoll {
        DiceShape.validate(count, sides);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitDice(this);
    }

    @Override
    public String toNotation() {
        return count + "d" + sides;
    }
}
