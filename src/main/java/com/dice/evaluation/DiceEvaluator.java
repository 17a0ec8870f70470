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
import com.dice.ast.RerollType;
import com.dice.config.DivisionByZeroPolicy;
import com.dice.exception.EvaluationException;
import com.dice.exception.MaxRerollsExceededException;
import com.dice.random.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluator for dice expressions.
 * <p>
 * Operands are evaluated left before right. Division is floor division; a zero
 * divisor is handled according to the configured {@link DivisionByZeroPolicy}.
 * The evaluator itself is stateless and may be shared; per-call state lives in
 * {@link EvaluationContext}.
 */
public class DiceEvaluator {

    private final int maxRerolls;
    private final DivisionByZeroPolicy divisionByZero;

    public DiceEvaluator(int maxRerolls, DivisionByZeroPolicy divisionByZero) {
        if (maxRerolls <= 0) {
            throw new IllegalArgumentException("maxRerolls must be positive: " + maxRerolls);
        }
        this.maxRerolls = maxRerolls;
        this.divisionByZero = divisionByZero;
    }

    /**
     * Evaluate a tree with a fresh context.
     *
     * @param ast    Root node
     * @param random Source of die faces
     * @return Expression value
     */
    public long evaluate(DiceNode ast, RandomSource random) {
        return evaluate(ast, new EvaluationContext(random));
    }

    /**
     * Evaluate a tree, collecting rolls and counters into the given context.
     *
     * @param ast     Root node
     * @param context Evaluation state
     * @return Expression value
     * @throws MaxRerollsExceededException if a die still meets its reroll condition after the limit
     * @throws EvaluationException         on division by zero (ERROR policy) or arithmetic overflow
     */
    public long evaluate(DiceNode ast, EvaluationContext context) {
        try {
            return ast.accept(new Walker(context));
        } catch (ArithmeticException e) {
            throw new EvaluationException("Arithmetic overflow while evaluating '" + ast.toNotation() + "'", e);
        }
    }

    public int getMaxRerolls() {
        return maxRerolls;
    }

    public DivisionByZeroPolicy getDivisionByZero() {
        return divisionByZero;
    }

    /**
     * Apply an arithmetic operator with this evaluator's division policy.
     */
    long apply(ArithmeticOperator operator, long left, long right) {
        return switch (operator) {
            case PLUS -> Math.addExact(left, right);
            case MINUS -> Math.subtractExact(left, right);
            case MULTIPLY -> Math.multiplyExact(left, right);
            case DIVIDE -> divide(left, right);
        };
    }

    private long divide(long left, long right) {
        if (right == 0) {
            if (divisionByZero == DivisionByZeroPolicy.ZERO) {
                return 0;
            }
            throw new EvaluationException("Division by zero: " + left + " / 0");
        }
        if (left == Long.MIN_VALUE && right == -1) {
            throw new ArithmeticException("long overflow");
        }
        return Math.floorDiv(left, right);
    }

    private final class Walker implements NodeVisitor<Long> {

        private final EvaluationContext context;

        private Walker(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public Long visitNumber(NumberLiteral node) {
            return recorded(node, node.value());
        }

        @Override
        public Long visitDice(DiceRoll node) {
            List<Integer> rolls = new ArrayList<>(node.count());
            long total = 0;
            for (int i = 0; i < node.count(); i++) {
                int face = context.roll(node.sides());
                rolls.add(face);
                total += face;
            }
            context.countDice(node.count());
            context.getRecorder().recordDiceRoll(node, rolls, total);
            return recorded(node, total);
        }

        @Override
        public Long visitBinary(BinaryOp node) {
            long left = node.left().accept(this);
            long right = node.right().accept(this);
            long result = apply(node.operator(), left, right);
            context.getRecorder().recordOperation(node.operator(), left, right, result);
            return recorded(node, result);
        }

        @Override
        public Long visitParentheses(Parentheses node) {
            long inner = node.inner().accept(this);
            context.getRecorder().recordParentheses(inner);
            return recorded(node, inner);
        }

        @Override
        public Long visitConditional(ConditionalDice node) {
            List<Integer> rolls = new ArrayList<>(node.count());
            long successes = 0;
            for (int i = 0; i < node.count(); i++) {
                int face = context.roll(node.sides());
                rolls.add(face);
                if (node.isSuccess(face)) {
                    successes++;
                }
            }
            context.countDice(node.count());
            context.getRecorder().recordConditionalDice(node, rolls, successes);
            return recorded(node, successes);
        }

        @Override
        public Long visitReroll(RerollDice node) {
            List<Integer> allRolls = new ArrayList<>();
            List<Long> finalValues = new ArrayList<>(node.count());
            int rerolls = 0;
            long total = 0;

            for (int i = 0; i < node.count(); i++) {
                int face = context.roll(node.sides());
                allRolls.add(face);
                long value = face;
                int dieRerolls = 0;

                while (node.shouldReroll(face)) {
                    if (dieRerolls >= maxRerolls) {
                        throw new MaxRerollsExceededException(maxRerolls, node.toNotation());
                    }
                    face = context.roll(node.sides());
                    allRolls.add(face);
                    dieRerolls++;
                    context.countReroll();

                    if (node.rerollType() == RerollType.EXPLODING) {
                        value += face;
                    } else {
                        value = face;
                    }
                    if (node.rerollType() == RerollType.ONCE) {
                        break;
                    }
                }

                rerolls += dieRerolls;
                finalValues.add(value);
                total += value;
            }

            context.countDice(node.count());
            context.getRecorder().recordRerollDice(node, allRolls, finalValues, rerolls, total);
            return recorded(node, total);
        }

        private long recorded(DiceNode node, long value) {
            context.countNode();
            context.getRecorder().recordNodeEvaluation(node, value);
            return value;
        }
    }
}
