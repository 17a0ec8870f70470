package com.dice.explanation;

import java.util.List;

/**
 * One recorded step of an evaluation.
 *
 * @param step        1-based sequence number
 * @param type        Step category
 * @param description Human-readable summary
 * @param value       Value produced by the step
 * @param details     Optional extra detail, null when not recorded
 * @param rolls       Die faces involved in the step, empty for non-dice steps
 */
public record EvaluationStep(int step, StepType type, String description, long value,
                             String details, List<Integer> rolls) {

    public EvaluationStep {
        rolls = rolls == null ? List.of() : List.copyOf(rolls);
    }

    public boolean hasDetails() {
        return details != null && !details.isEmpty();
    }
}
