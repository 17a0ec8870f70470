package com.dice.ast;

final class DiceShape {

    private DiceShape() {
    }

    static void validate(int count, int sides) {
        if (count <= 0) {
            throw new IllegalArgumentException("Dice count must be positive: " + count);
        }
        if (sides <= 0) {
            throw new IllegalArgumentException("Dice sides must be positive: " + sides);
        }
    }
}
