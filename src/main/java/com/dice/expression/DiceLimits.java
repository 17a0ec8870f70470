package com.dice.expression;

/**
 * Input limits enforced while reading an expression.
 *
 * @param maxExpressionLength Longest accepted raw expression, checked before scanning
 * @param maxDiceCount        Most dice allowed in one dice term
 * @param maxDiceSides        Most faces allowed on one die
 */
public record DiceLimits(int maxExpressionLength, int maxDiceCount, int maxDiceSides) {

    public static final int DEFAULT_MAX_EXPRESSION_LENGTH = 1000;
    public static final int DEFAULT_MAX_DICE_COUNT = 1000;
    public static final int DEFAULT_MAX_DICE_SIDES = 10000;

    public static DiceLimits defaults() {
        return new DiceLimits(DEFAULT_MAX_EXPRESSION_LENGTH, DEFAULT_MAX_DICE_COUNT, DEFAULT_MAX_DICE_SIDES);
    }
}
