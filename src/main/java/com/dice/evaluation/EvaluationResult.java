package com.dice.evaluation;

import java.util.List;

/**
 * Detailed result of evaluating one expression.
 *
 * @param expression         Expression as supplied
 * @param value              Expression value
 * @param rolls              Every face drawn, rerolls included, in draw order
 * @param minValue           Smallest value the expression can produce
 * @param maxValue           Largest value the expression can produce
 * @param executionTimeMs    Wall-clock evaluation time
 * @param metrics            Evaluation counters
 * @param timeBudgetExceeded Whether evaluation took longer than the configured budget
 */
public record EvaluationResult(
        String expression,
        long value,
        List<Integer> rolls,
        long minValue,
        long maxValue,
        long executionTimeMs,
        EvaluationMetrics metrics,
        boolean timeBudgetExceeded
) {
    public EvaluationResult {
        rolls = List.copyOf(rolls);
    }

    public Range range() {
        return new Range(minValue, maxValue);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "expression='" + expression + '\'' +
                ", value=" + value +
                ", rolls=" + rolls +
                ", range=[" + minValue + ", " + maxValue + "]" +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
