package com.dice.evaluation;

import com.dice.config.DivisionByZeroPolicy;
import com.dice.exception.EvaluationException;
import com.dice.expression.DiceExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RangeAnalyzer.
 */
class RangeAnalyzerTest {

    private DiceExpressionParser parser;
    private RangeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        parser = new DiceExpressionParser();
        analyzer = new RangeAnalyzer(DivisionByZeroPolicy.ERROR, 6);
    }

    @ParameterizedTest
    @CsvSource({
            "5,                 5,   5",
            "3d6,               3,   18",
            "3d6+5,             8,   23",
            "(2d6+3)*2,         10,  30",
            "4d6>3,             0,   4",
            "2d6r1,             2,   72",
            "2d6ro1,            2,   12",
            "2d6rr1,            2,   12",
            "10-1d4,            6,   9",
            "1d6-1d6,           -5,  5",
            "20/1d4,            5,   20",
            "1d6*(1d4-2),       -6,  12",
            "12/(1d3-2),        -12, 12",
            "6/(1d2-1),         6,   6"
    })
    @DisplayName("Should compute bounds from the expression shape")
    void shouldComputeBounds(String expression, long min, long max) {
        assertEquals(new Range(min, max), analyzer.range(parser.parse(expression)));
    }

    @Test
    @DisplayName("Should scale exploding dice by the configured multiplier")
    void shouldScaleExplodingDice() {
        RangeAnalyzer tripled = new RangeAnalyzer(DivisionByZeroPolicy.ERROR, 3);

        assertEquals(new Range(1, 30), tripled.range(parser.parse("1d10r10")));
    }

    @Test
    @DisplayName("Zero divisors should widen the range under the ZERO policy")
    void zeroPolicyShouldIncludeZero() {
        RangeAnalyzer lenient = new RangeAnalyzer(DivisionByZeroPolicy.ZERO, 6);

        assertEquals(new Range(0, 6), lenient.range(parser.parse("6/(1d2-1)")));
        assertEquals(Range.of(0), lenient.range(parser.parse("5/(1-1)")));
    }

    @Test
    @DisplayName("A divisor that is always zero should fail under the ERROR policy")
    void alwaysZeroDivisorShouldFail() {
        assertThrows(EvaluationException.class, () -> analyzer.range(parser.parse("5/(1-1)")));
    }

    @Test
    @DisplayName("Bounds that do not fit in a long should saturate")
    void shouldSaturateOverflowingBounds() {
        Range product = analyzer.range(parser.parse("1d10000r10000*1d10000r10000*1d10000r10000*1d10000r10000"));
        assertEquals(new Range(1, Long.MAX_VALUE), product);

        assertEquals(Range.of(Long.MAX_VALUE), analyzer.range(parser.parse("9223372036854775807+1d6")));
        assertEquals(Range.of(Long.MIN_VALUE), analyzer.range(parser.parse("0-9223372036854775807-1d6")));
        assertEquals(Range.of(Long.MAX_VALUE), analyzer.range(parser.parse("(0-9223372036854775807-1)/(0-1)")));
    }

    @Test
    @DisplayName("Range helpers should report average and membership")
    void rangeHelpers() {
        Range range = new Range(3, 18);

        assertEquals(10.5, range.average());
        assertTrue(range.contains(3));
        assertFalse(range.contains(19));
        assertEquals("[3, 18]", range.toString());
        assertThrows(IllegalArgumentException.class, () -> new Range(2, 1));
    }
}
