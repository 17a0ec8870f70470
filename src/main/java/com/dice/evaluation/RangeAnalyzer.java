package com.dice.evaluation;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.BinaryOp;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceNode;
import com.dice.ast.DiceRoll;
import com.dice.ast.NodeVisitor;
import com.dice.ast.NumberLiteral;
import com.dice.ast.Parentheses;
import com.dice.ast.RerollDice;
import com.dice.config.DivisionByZeroPolicy;
import com.dice.exception.EvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes static bounds of an expression from its shape alone.
 * <p>
 * Products and quotients use the four-corner rule over operand bounds. For
 * division, zero divisors follow the same {@link DivisionByZeroPolicy} as
 * {@link DiceEvaluator}: under ERROR they are excluded (a divisor that can only
 * be zero is an error), under ZERO they contribute a result of 0.
 * <p>
 * Exploding dice are unbounded in principle; their ceiling is
 * {@code count * sides * explodingMultiplier}.
 * <p>
 * Bounds saturate at {@code Long.MIN_VALUE} and {@code Long.MAX_VALUE}: a bound
 * that does not fit in a long is reported as the nearest representable one.
 */
public class RangeAnalyzer implements NodeVisitor<Range> {

    private final DivisionByZeroPolicy divisionByZero;
    private final int explodingMultiplier;

    public RangeAnalyzer(DivisionByZeroPolicy divisionByZero, int explodingMultiplier) {
        this.divisionByZero = divisionByZero;
        this.explodingMultiplier = explodingMultiplier;
    }

    /**
     * Bounds of the given expression.
     *
     * @throws EvaluationException if every possible divisor of some division is zero under the ERROR policy
     */
    public Range range(DiceNode ast) {
        return ast.accept(this);
    }

    @Override
    public Range visitNumber(NumberLiteral node) {
        return Range.of(node.value());
    }

    @Override
    public Range visitDice(DiceRoll node) {
        return new Range(node.count(), (long) node.count() * node.sides());
    }

    @Override
    public Range visitBinary(BinaryOp node) {
        Range left = node.left().accept(this);
        Range right = node.right().accept(this);
        return combine(node.operator(), left, right);
    }

    @Override
    public Range visitParentheses(Parentheses node) {
        return node.inner().accept(this);
    }

    @Override
    public Range visitConditional(ConditionalDice node) {
        return new Range(0, node.count());
    }

    @Override
    public Range visitReroll(RerollDice node) {
        long plainMax = (long) node.count() * node.sides();
        return switch (node.rerollType()) {
            case EXPLODING -> new Range(node.count(), saturatedMultiply(plainMax, explodingMultiplier));
            case ONCE, RECURSIVE -> new Range(node.count(), plainMax);
        };
    }

    Range combine(ArithmeticOperator operator, Range left, Range right) {
        return switch (operator) {
            case PLUS -> new Range(saturatedAdd(left.min(), right.min()), saturatedAdd(left.max(), right.max()));
            case MINUS -> new Range(saturatedSubtract(left.min(), right.max()),
                    saturatedSubtract(left.max(), right.min()));
            case MULTIPLY -> corners(left, List.of(right.min(), right.max()), false);
            case DIVIDE -> divide(left, right);
        };
    }

    private Range divide(Range left, Range right) {
        List<Long> divisors = new ArrayList<>();
        addDivisor(divisors, right.min());
        addDivisor(divisors, right.max());
        // Smallest-magnitude divisors give the largest quotients
        if (right.contains(1)) {
            addDivisor(divisors, 1);
        }
        if (right.contains(-1)) {
            addDivisor(divisors, -1);
        }

        boolean zeroPossible = right.contains(0);
        if (divisors.isEmpty()) {
            if (divisionByZero == DivisionByZeroPolicy.ZERO) {
                return Range.of(0);
            }
            throw new EvaluationException("Division by zero: divisor is always 0");
        }

        Range quotients = corners(left, divisors, true);
        if (zeroPossible && divisionByZero == DivisionByZeroPolicy.ZERO) {
            return new Range(Math.min(0, quotients.min()), Math.max(0, quotients.max()));
        }
        return quotients;
    }

    private static void addDivisor(List<Long> divisors, long divisor) {
        if (divisor != 0 && !divisors.contains(divisor)) {
            divisors.add(divisor);
        }
    }

    private static Range corners(Range left, List<Long> rightValues, boolean divide) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long l : new long[]{left.min(), left.max()}) {
            for (long r : rightValues) {
                long value = divide ? saturatedFloorDiv(l, r) : saturatedMultiply(l, r);
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        return new Range(min, max);
    }

    static long saturatedAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return sum;
    }

    static long saturatedSubtract(long a, long b) {
        long difference = a - b;
        if (((a ^ b) & (a ^ difference)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return difference;
    }

    static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return low;
        }
        return (a < 0) == (b < 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
    }

    static long saturatedFloorDiv(long a, long b) {
        // The only quotient that does not fit
        if (a == Long.MIN_VALUE && b == -1) {
            return Long.MAX_VALUE;
        }
        return Math.floorDiv(a, b);
    }
}
