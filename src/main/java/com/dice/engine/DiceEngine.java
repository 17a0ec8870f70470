package com.dice.engine;

import com.dice.ast.DiceNode;
import com.dice.cache.CacheStats;
import com.dice.evaluation.EvaluationResult;
import com.dice.evaluation.Range;
import com.dice.random.RandomSource;

import java.util.List;

/**
 * Entry points for evaluating dice-notation expressions.
 * <p>
 * Methods without a {@link RandomSource} argument use the engine's default source.
 * Every error is raised as a {@link com.dice.exception.DiceException} subtype;
 * the engine never recovers from one internally.
 */
public interface DiceEngine {

    /**
     * Evaluate an expression to its value.
     */
    long evaluate(String expression);

    long evaluate(String expression, RandomSource random);

    /**
     * Evaluate an expression, returning rolls, bounds and timing alongside the value.
     */
    EvaluationResult evaluateDetailed(String expression);

    EvaluationResult evaluateDetailed(String expression, RandomSource random);

    /**
     * Evaluate an expression while recording every step.
     */
    ExplainedResult evaluateWithExplanation(String expression);

    ExplainedResult evaluateWithExplanation(String expression, RandomSource random);

    /**
     * Evaluate an expression and render its explanation.
     */
    String explain(String expression, ExplanationFormat format);

    /**
     * Parse an expression without evaluating it.
     */
    DiceNode parse(String expression);

    /**
     * Check whether an expression parses. Never throws for bad input.
     */
    boolean validate(String expression);

    /**
     * Messages describing why an expression does not parse; empty when it does.
     */
    List<String> getValidationErrors(String expression);

    /**
     * Static bounds of an expression.
     */
    Range range(String expression);

    void clearCache();

    CacheStats getCacheStats();
}
