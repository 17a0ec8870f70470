package com.dice.explanation;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.BinaryOp;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceNode;
import com.dice.ast.DiceRoll;
import com.dice.ast.NodeVisitor;
import com.dice.ast.NumberLiteral;
import com.dice.ast.Parentheses;
import com.dice.ast.RerollDice;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Records evaluation steps for one expression.
 * Not thread-safe; create one per evaluation.
 */
public class DefaultExplanationRecorder implements ExplanationRecorder {

    private final String expression;
    private final ExplanationOptions options;
    private final List<EvaluationStep> steps = new ArrayList<>();
    private List<String> tokenization = List.of();
    private String parsing = "";
    private Long finalResult;
    private Long executionTimeMs;

    public DefaultExplanationRecorder(String expression, ExplanationOptions options) {
        this.expression = expression;
        this.options = options;
    }

    public DefaultExplanationRecorder(String expression) {
        this(expression, ExplanationOptions.defaults());
    }

    @Override
    public void recordTokenization(List<String> tokens) {
        if (!options.includeTokenization()) {
            return;
        }
        tokenization = List.copyOf(tokens);
        String details = null;
        if (options.verboseMode()) {
            details = "Each token represents a distinct element: " + IntStream.range(0, tokens.size())
                    .mapToObj(i -> (i + 1) + ". \"" + tokens.get(i) + "\"")
                    .collect(Collectors.joining(", "));
        }
        addStep(StepType.TOKENIZATION, "Tokenized expression into: " + String.join(", ", tokens),
                tokens.size(), details, null);
    }

    @Override
    public void recordParsing(String description, int nodeCount) {
        if (!options.includeParsing()) {
            return;
        }
        parsing = description;
        String details = options.verboseMode()
                ? "Abstract syntax tree contains " + nodeCount + " nodes"
                : null;
        addStep(StepType.PARSING, "Parsed tokens into AST: " + description, nodeCount, details, null);
    }

    @Override
    public void recordNodeEvaluation(DiceNode node, long result) {
        if (!options.includeIntermediateSteps()) {
            return;
        }
        String details = options.verboseMode() ? node.accept(VERBOSE_DESCRIPTION) : null;
        addStep(StepType.EVALUATION, describe(node, result), result, details, null);
    }

    @Override
    public void recordDiceRoll(DiceRoll node, List<Integer> rolls, long total) {
        String details = null;
        if (options.includeDiceDetails()) {
            details = "Individual rolls: [" + IntStream.range(0, rolls.size())
                    .mapToObj(i -> "die " + (i + 1) + ": " + rolls.get(i))
                    .collect(Collectors.joining(", ")) + "]";
        }
        addStep(StepType.DICE_ROLL, "Rolled " + node.toNotation() + ": " + join(rolls) + " (total: " + total + ")",
                total, details, rolls);
    }

    @Override
    public void recordConditionalDice(ConditionalDice node, List<Integer> rolls, long successes) {
        String details = null;
        if (options.includeDiceDetails()) {
            List<Integer> hits = rolls.stream().filter(node::isSuccess).toList();
            List<Integer> misses = rolls.stream().filter(r -> !node.isSuccess(r)).toList();
            details = "Rolls: " + join(rolls) + " | Successes: [" + join(hits) + "] | Failures: [" + join(misses) + "]";
        }
        addStep(StepType.CONDITIONAL, "Evaluated " + node.count() + "d" + node.sides() + " with condition "
                        + node.operator().symbol() + node.threshold() + ": " + successes + " successes",
                successes, details, rolls);
    }

    @Override
    public void recordRerollDice(RerollDice node, List<Integer> allRolls, List<Long> finalValues,
                                 int rerolls, long total) {
        String details = null;
        if (options.includeDiceDetails()) {
            details = "All rolls: [" + join(allRolls) + "] | Final values: [" + join(finalValues)
                    + "] | Reroll type: " + node.rerollType().displayName();
        }
        addStep(StepType.REROLL, "Rolled " + node.count() + "d" + node.sides() + " with rerolls on "
                        + node.conditionText() + ": " + total + " (" + rerolls + " rerolls)",
                total, details, allRolls);
    }

    @Override
    public void recordOperation(ArithmeticOperator operator, long left, long right, long result) {
        String details = options.verboseMode() ? describeOperation(operator, left, right, result) : null;
        addStep(StepType.OPERATION, left + " " + operator.symbol() + " " + right + " = " + result,
                result, details, null);
    }

    @Override
    public void recordParentheses(long innerResult) {
        String details = options.verboseMode()
                ? "Parentheses force evaluation order by grouping sub-expressions"
                : null;
        addStep(StepType.PARENTHESES, "Evaluated parenthetical expression: " + innerResult,
                innerResult, details, null);
    }

    @Override
    public void recordFinalResult(long value) {
        finalResult = value;
        addStep(StepType.FINAL_RESULT, "Final result: " + value, value, null, null);
    }

    @Override
    public void recordExecutionTime(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    @Override
    public Explanation toExplanation() {
        long result;
        if (finalResult != null) {
            result = finalResult;
        } else {
            result = steps.isEmpty() ? 0 : steps.get(steps.size() - 1).value();
        }
        return new Explanation(expression, tokenization, parsing, steps, result, executionTimeMs);
    }

    public ExplanationOptions getOptions() {
        return options;
    }

    public int getStepCount() {
        return steps.size();
    }

    private void addStep(StepType type, String description, long value, String details, List<Integer> rolls) {
        steps.add(new EvaluationStep(steps.size() + 1, type, description, value, details, rolls));
    }

    private static String join(List<? extends Number> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static String describe(DiceNode node, long result) {
        return node.accept(new NodeVisitor<>() {
            @Override
            public String visitNumber(NumberLiteral n) {
                return "Number literal: " + n.value();
            }

            @Override
            public String visitDice(DiceRoll n) {
                return "Dice expression: " + n.toNotation() + " = " + result;
            }

            @Override
            public String visitBinary(BinaryOp n) {
                return "Binary operation: " + n.operator().symbol() + " = " + result;
            }

            @Override
            public String visitParentheses(Parentheses n) {
                return "Parenthetical expression = " + result;
            }

            @Override
            public String visitConditional(ConditionalDice n) {
                return "Conditional dice: " + n.toNotation() + " = " + result;
            }

            @Override
            public String visitReroll(RerollDice n) {
                return "Reroll dice: " + n.toNotation() + " = " + result;
            }
        });
    }

    private static String describeOperation(ArithmeticOperator operator, long left, long right, long result) {
        return switch (operator) {
            case PLUS -> "Addition: combining " + left + " and " + right + " to get " + result;
            case MINUS -> "Subtraction: removing " + right + " from " + left + " to get " + result;
            case MULTIPLY -> "Multiplication: " + left + " times " + right + " equals " + result;
            case DIVIDE -> "Division: " + left + " divided by " + right + " equals " + result
                    + " (floor division)";
        };
    }

    private static final NodeVisitor<String> VERBOSE_DESCRIPTION = new NodeVisitor<>() {
        @Override
        public String visitNumber(NumberLiteral node) {
            return "Constant value";
        }

        @Override
        public String visitDice(DiceRoll node) {
            return "Rolling " + node.count() + " dice with " + node.sides() + " sides each";
        }

        @Override
        public String visitBinary(BinaryOp node) {
            return "Performing " + node.operator().displayName() + " operation";
        }

        @Override
        public String visitParentheses(Parentheses node) {
            return "Grouped sub-expression";
        }

        @Override
        public String visitConditional(ConditionalDice node) {
            return "Counting successes where each die roll " + node.operator().symbol() + " " + node.threshold();
        }

        @Override
        public String visitReroll(RerollDice node) {
            return "Rerolling dice that meet condition: " + node.conditionText();
        }
    };
}
