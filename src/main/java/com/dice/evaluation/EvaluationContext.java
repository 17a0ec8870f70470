package com.dice.evaluation;

import com.dice.explanation.ExplanationRecorder;
import com.dice.explanation.NoOpExplanationRecorder;
import com.dice.random.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State of a single evaluation: the random source, the attached recorder,
 * every face drawn, and the running counters.
 * Not thread-safe; create one per evaluation.
 */
public class EvaluationContext {

    private final RandomSource random;
    private final ExplanationRecorder recorder;
    private final List<Integer> rolls = new ArrayList<>();
    private int nodesEvaluated;
    private int diceRolled;
    private int rerollsPerformed;

    public EvaluationContext(RandomSource random, ExplanationRecorder recorder) {
        this.random = Objects.requireNonNull(random, "random");
        this.recorder = recorder != null ? recorder : NoOpExplanationRecorder.INSTANCE;
    }

    public EvaluationContext(RandomSource random) {
        this(random, NoOpExplanationRecorder.INSTANCE);
    }

    /**
     * Draw one face and remember it.
     */
    int roll(int sides) {
        int face = random.roll(sides);
        rolls.add(face);
        return face;
    }

    void countNode() {
        nodesEvaluated++;
    }

    void countDice(int count) {
        diceRolled += count;
    }

    void countReroll() {
        rerollsPerformed++;
    }

    public ExplanationRecorder getRecorder() {
        return recorder;
    }

    public RandomSource getRandom() {
        return random;
    }

    /**
     * Every face drawn so far, rerolls included, in draw order.
     */
    public List<Integer> getRolls() {
        return Collections.unmodifiableList(rolls);
    }

    public EvaluationMetrics getMetrics() {
        return new EvaluationMetrics(nodesEvaluated, diceRolled, rerollsPerformed);
    }
}
