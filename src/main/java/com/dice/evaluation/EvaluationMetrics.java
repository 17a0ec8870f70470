package com.dice.evaluation;

/**
 * Counters collected during one evaluation.
 *
 * @param nodesEvaluated   Nodes visited
 * @param diceRolled       Individual dice drawn, rerolls excluded
 * @param rerollsPerformed Extra draws made by reroll mechanics
 */
public record EvaluationMetrics(int nodesEvaluated, int diceRolled, int rerollsPerformed) {

    public static EvaluationMetrics empty() {
        return new EvaluationMetrics(0, 0, 0);
    }
}
