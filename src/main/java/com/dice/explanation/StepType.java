package com.dice.explanation;

/**
 * Categories of recorded evaluation steps.
 */
public enum StepType {
    TOKENIZATION,
    PARSING,
    EVALUATION,
    DICE_ROLL,
    CONDITIONAL,
    REROLL,
    OPERATION,
    PARENTHESES,
    FINAL_RESULT;

    public String displayName() {
        return name().toLowerCase();
    }
}
