package com.dice.explanation;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceNode;
import com.dice.ast.DiceRoll;
import com.dice.ast.RerollDice;

import java.util.List;

/**
 * Observer of an evaluation pass.
 * <p>
 * Recorders only observe: the evaluator produces the same values with or
 * without one attached, and draws the same number of random values.
 */
public interface ExplanationRecorder {

    void recordTokenization(List<String> tokens);

    void recordParsing(String description, int nodeCount);

    /**
     * Called after any node has produced its value.
     */
    void recordNodeEvaluation(DiceNode node, long result);

    void recordDiceRoll(DiceRoll node, List<Integer> rolls, long total);

    void recordConditionalDice(ConditionalDice node, List<Integer> rolls, long successes);

    /**
     * @param allRolls    Every face drawn, rerolls included, in draw order
     * @param finalValues Resulting value per die
     * @param rerolls     Rerolls performed across all dice
     */
    void recordRerollDice(RerollDice node, List<Integer> allRolls, List<Long> finalValues, int rerolls, long total);

    void recordOperation(ArithmeticOperator operator, long left, long right, long result);

    void recordParentheses(long innerResult);

    void recordFinalResult(long value);

    void recordExecutionTime(long executionTimeMs);

    /**
     * Snapshot of everything recorded so far.
     */
    Explanation toExplanation();
}
