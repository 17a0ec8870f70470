package com.dice.explanation;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceNode;
import com.dice.ast.DiceRoll;
import com.dice.ast.RerollDice;

import java.util.List;

/**
 * Recorder used when no explanation is requested.
 */
public final class NoOpExplanationRecorder implements ExplanationRecorder {

    public static final NoOpExplanationRecorder INSTANCE = new NoOpExplanationRecorder();

    private NoOpExplanationRecorder() {
    }

    @Override
    public void recordTokenization(List<String> tokens) {
    }

    @Override
    public void recordParsing(String description, int nodeCount) {
    }

    @Override
    public void recordNodeEvaluation(DiceNode node, long result) {
    }

    @Override
    public void recordDiceRoll(DiceRoll node, List<Integer> rolls, long total) {
    }

    @Override
    public void recordConditionalDice(ConditionalDice node, List<Integer> rolls, long successes) {
    }

    @Override
    public void recordRerollDice(RerollDice node, List<Integer> allRolls, List<Long> finalValues,
                                 int rerolls, long total) {
    }

    @Override
    public void recordOperation(ArithmeticOperator operator, long left, long right, long result) {
    }

    @Override
    public void recordParentheses(long innerResult) {
    }

    @Override
    public void recordFinalResult(long value) {
    }

    @Override
    public void recordExecutionTime(long executionTimeMs) {
    }

    @Override
    public Explanation toExplanation() {
        return new Explanation("", List.of(), "", List.of(), 0, null);
    }
}
