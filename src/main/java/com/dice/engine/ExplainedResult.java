package com.dice.engine;

import com.dice.evaluation.EvaluationResult;
import com.dice.explanation.Explanation;

/**
 * Evaluation result together with its step-by-step explanation.
 *
 * @param result      Detailed evaluation result
 * @param explanation Recorded steps
 */
public record ExplainedResult(EvaluationResult result, Explanation explanation) {
}
