package com.dice.config;

import com.dice.exception.ConfigurationException;
import com.dice.expression.DiceLimits;
import com.dice.explanation.ExplanationOptions;

/**
 * Root configuration for the dice engine.
 *
 * @param maxRerolls               Rerolls allowed per die before evaluation fails
 * @param maxExpressionLength      Longest accepted expression, checked before tokenization
 * @param enableCaching            Whether parsed expressions are cached by source text
 * @param cacheSize                Cache capacity
 * @param maxDiceCount             Most dice allowed in one dice term
 * @param maxDiceSides             Most faces allowed on one die
 * @param maxExecutionTimeMs       Time budget recorded with each result; flagged, not enforced
 * @param divisionByZero           Division-by-zero policy
 * @param explodingRangeMultiplier Per-die ceiling factor used for exploding dice ranges
 * @param randomSeed               Seed for the engine's default random source, null for system randomness
 * @param explanation              Explanation recording and rendering options
 */
public record DiceConfig(
        int maxRerolls,
        int maxExpressionLength,
        boolean enableCaching,
        int cacheSize,
        int maxDiceCount,
        int maxDiceSides,
        long maxExecutionTimeMs,
        DivisionByZeroPolicy divisionByZero,
        int explodingRangeMultiplier,
        Long randomSeed,
        ExplanationOptions explanation
) {
    public static final int DEFAULT_MAX_REROLLS = 100;
    public static final int DEFAULT_CACHE_SIZE = 100;
    public static final long DEFAULT_MAX_EXECUTION_TIME_MS = 5000;
    public static final int DEFAULT_EXPLODING_RANGE_MULTIPLIER = 6;

    public DiceConfig {
        requirePositive("max-rerolls", maxRerolls);
        requirePositive("max-expression-length", maxExpressionLength);
        requirePositive("cache-size", cacheSize);
        requirePositive("max-dice-count", maxDiceCount);
        requirePositive("max-dice-sides", maxDiceSides);
        requirePositive("max-execution-time-ms", maxExecutionTimeMs);
        requirePositive("exploding-range-multiplier", explodingRangeMultiplier);
        if (divisionByZero == null) {
            divisionByZero = DivisionByZeroPolicy.ERROR;
        }
        if (explanation == null) {
            explanation = ExplanationOptions.defaults();
        }
    }

    /**
     * Default configuration.
     */
    public static DiceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Limits applied while reading expressions.
     */
    public DiceLimits limits() {
        return new DiceLimits(maxExpressionLength, maxDiceCount, maxDiceSides);
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRerolls(maxRerolls)
                .maxExpressionLength(maxExpressionLength)
                .enableCaching(enableCaching)
                .cacheSize(cacheSize)
                .maxDiceCount(maxDiceCount)
                .maxDiceSides(maxDiceSides)
                .maxExecutionTimeMs(maxExecutionTimeMs)
                .divisionByZero(divisionByZero)
                .explodingRangeMultiplier(explodingRangeMultiplier)
                .randomSeed(randomSeed)
                .explanation(explanation);
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException("'" + key + "' must be positive, got " + value);
        }
    }

    /**
     * Builder for {@link DiceConfig}, pre-populated with defaults.
     */
    public static final class Builder {
        private int maxRerolls = DEFAULT_MAX_REROLLS;
        private int maxExpressionLength = DiceLimits.DEFAULT_MAX_EXPRESSION_LENGTH;
        private boolean enableCaching = true;
        private int cacheSize = DEFAULT_CACHE_SIZE;
        private int maxDiceCount = DiceLimits.DEFAULT_MAX_DICE_COUNT;
        private int maxDiceSides = DiceLimits.DEFAULT_MAX_DICE_SIDES;
        private long maxExecutionTimeMs = DEFAULT_MAX_EXECUTION_TIME_MS;
        private DivisionByZeroPolicy divisionByZero = DivisionByZeroPolicy.ERROR;
        private int explodingRangeMultiplier = DEFAULT_EXPLODING_RANGE_MULTIPLIER;
        private Long randomSeed;
        private ExplanationOptions explanation = ExplanationOptions.defaults();

        private Builder() {
        }

        public Builder maxRerolls(int maxRerolls) {
            this.maxRerolls = maxRerolls;
            return this;
        }

        public Builder maxExpressionLength(int maxExpressionLength) {
            this.maxExpressionLength = maxExpressionLength;
            return this;
        }

        public Builder enableCaching(boolean enableCaching) {
            this.enableCaching = enableCaching;
            return this;
        }

        public Builder cacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder maxDiceCount(int maxDiceCount) {
            this.maxDiceCount = maxDiceCount;
            return this;
        }

        public Builder maxDiceSides(int maxDiceSides) {
            this.maxDiceSides = maxDiceSides;
            return this;
        }

        public Builder maxExecutionTimeMs(long maxExecutionTimeMs) {
            this.maxExecutionTimeMs = maxExecutionTimeMs;
            return this;
        }

        public Builder divisionByZero(DivisionByZeroPolicy divisionByZero) {
            this.divisionByZero = divisionByZero;
            return this;
        }

        public Builder explodingRangeMultiplier(int explodingRangeMultiplier) {
            this.explodingRangeMultiplier = explodingRangeMultiplier;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder explanation(ExplanationOptions explanation) {
            this.explanation = explanation;
            return this;
        }

        public DiceConfig build() {
            return new DiceConfig(maxRerolls, maxExpressionLength, enableCaching, cacheSize,
                    maxDiceCount, maxDiceSides, maxExecutionTimeMs, divisionByZero,
                    explodingRangeMultiplier, randomSeed, explanation);
        }
    }
}
