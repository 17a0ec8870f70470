package com.dice.explanation;

import java.util.List;

/**
 * Complete record of one explained evaluation.
 *
 * @param originalExpression Expression as supplied
 * @param tokenization       Token texts in order
 * @param parsing            Parsing summary, empty when not recorded
 * @param steps              Recorded steps in order
 * @param finalResult        Value of the whole expression
 * @param executionTimeMs    Wall-clock evaluation time, null when not recorded
 */
public record Explanation(String originalExpression, List<String> tokenization, String parsing,
                          List<EvaluationStep> steps, long finalResult, Long executionTimeMs) {

    public Explanation {
        tokenization = List.copyOf(tokenization);
        steps = List.copyOf(steps);
    }

    /**
     * Steps of one category, in recording order.
     */
    public List<EvaluationStep> stepsOfType(StepType type) {
        return steps.stream().filter(s -> s.type() == type).toList();
    }
}
