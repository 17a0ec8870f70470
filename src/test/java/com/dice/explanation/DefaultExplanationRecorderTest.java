package com.dice.explanation;

import com.dice.ast.ComparisonOperator;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceRoll;
import com.dice.ast.RerollDice;
import com.dice.ast.RerollType;
import com.dice.config.DivisionByZeroPolicy;
import com.dice.evaluation.DiceEvaluator;
import com.dice.evaluation.EvaluationContext;
import com.dice.expression.DiceExpressionParser;
import com.dice.support.ScriptedRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultExplanationRecorder and ExplanationFormatter.
 */
class DefaultExplanationRecorderTest {

    private static Explanation explain(String expression, ExplanationOptions options, int... faces) {
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder(expression, options);
        DiceEvaluator evaluator = new DiceEvaluator(100, DivisionByZeroPolicy.ERROR);
        long value = evaluator.evaluate(new DiceExpressionParser().parse(expression),
                new EvaluationContext(ScriptedRandomSource.of(faces), recorder));
        recorder.recordFinalResult(value);
        return recorder.toExplanation();
    }

    private static List<String> descriptions(Explanation explanation) {
        return explanation.steps().stream().map(EvaluationStep::description).toList();
    }

    @Test
    @DisplayName("Should record dice, operations and the final result in order")
    void shouldRecordStepsInOrder() {
        Explanation explanation = explain("3d6+5", ExplanationOptions.defaults(), 2, 3, 4);

        assertEquals(List.of(
                "Rolled 3d6: 2, 3, 4 (total: 9)",
                "Dice expression: 3d6 = 9",
                "Number literal: 5",
                "9 + 5 = 14",
                "Binary operation: + = 14",
                "Final result: 14"
        ), descriptions(explanation));
        assertEquals(14, explanation.finalResult());

        for (int i = 0; i < explanation.steps().size(); i++) {
            assertEquals(i + 1, explanation.steps().get(i).step());
        }
    }

    @Test
    @DisplayName("Should skip intermediate node steps when disabled")
    void shouldSkipIntermediateSteps() {
        ExplanationOptions options = new ExplanationOptions(true, true, false, true, false, false);

        Explanation explanation = explain("(1d6+2)*2", options, 3);

        assertEquals(List.of(
                "Rolled 1d6: 3 (total: 3)",
                "3 + 2 = 5",
                "Evaluated parenthetical expression: 5",
                "5 * 2 = 10",
                "Final result: 10"
        ), descriptions(explanation));
    }

    @Test
    @DisplayName("Should describe conditional dice with their successes")
    void shouldDescribeConditionalDice() {
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder("4d6>3");
        ConditionalDice node = new ConditionalDice(4, 6, ComparisonOperator.GREATER_THAN, 3);

        recorder.recordConditionalDice(node, List.of(5, 4, 2, 6), 3);

        EvaluationStep step = recorder.toExplanation().steps().get(0);
        assertEquals(StepType.CONDITIONAL, step.type());
        assertEquals("Evaluated 4d6 with condition >3: 3 successes", step.description());
        assertEquals("Rolls: 5, 4, 2, 6 | Successes: [5, 4, 6] | Failures: [2]", step.details());
        assertEquals(List.of(5, 4, 2, 6), step.rolls());
    }

    @Test
    @DisplayName("Should describe reroll dice with the reroll count")
    void shouldDescribeRerollDice() {
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder("2d6r1");
        RerollDice node = new RerollDice(2, 6, RerollType.EXPLODING, ComparisonOperator.EQUAL, 1);

        recorder.recordRerollDice(node, List.of(1, 5, 3), List.of(6L, 3L), 1, 9);

        EvaluationStep step = recorder.toExplanation().steps().get(0);
        assertEquals("Rolled 2d6 with rerolls on =1: 9 (1 rerolls)", step.description());
        assertTrue(step.details().contains("Reroll type: " + RerollType.EXPLODING.displayName()));
    }

    @Test
    @DisplayName("Should omit dice details when disabled")
    void shouldOmitDiceDetails() {
        ExplanationOptions options = new ExplanationOptions(true, true, true, false, false, false);
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder("1d6", options);

        recorder.recordDiceRoll(new DiceRoll(1, 6), List.of(4), 4);

        assertFalse(recorder.toExplanation().steps().get(0).hasDetails());
    }

    @Test
    @DisplayName("Should honour tokenization and parsing switches")
    void shouldHonourTokenizationSwitches() {
        ExplanationOptions options = new ExplanationOptions(false, false, true, true, false, false);
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder("1+2", options);

        recorder.recordTokenization(List.of("1", "+", "2"));
        recorder.recordParsing("1 + 2", 3);

        Explanation explanation = recorder.toExplanation();
        assertEquals(0, recorder.getStepCount());
        assertTrue(explanation.tokenization().isEmpty());
        assertEquals("", explanation.parsing());
    }

    @Test
    @DisplayName("Verbose mode should attach details to every operation")
    void verboseModeShouldAddDetails() {
        Explanation explanation = explain("7/2", ExplanationOptions.verbose());

        EvaluationStep division = explanation.stepsOfType(StepType.OPERATION).get(0);
        assertEquals("7 / 2 = 3", division.description());
        assertEquals("Division: 7 divided by 2 equals 3 (floor division)", division.details());
    }

    @Test
    @DisplayName("Should render plain text")
    void shouldRenderText() {
        DefaultExplanationRecorder recorder = new DefaultExplanationRecorder("3d6+5");
        recorder.recordTokenization(List.of("3d6", "+", "5"));
        recorder.recordParsing("3d6 + 5", 3);
        recorder.recordFinalResult(14);
        recorder.recordExecutionTime(2);

        String text = ExplanationFormatter.toText(recorder.toExplanation(), ExplanationOptions.defaults());

        assertTrue(text.startsWith("Expression: 3d6+5"));
        assertTrue(text.contains("Tokenization: 3d6 -> + -> 5"));
        assertTrue(text.contains("Parsing: 3d6 + 5"));
        assertTrue(text.contains("  3. Final result: 14"));
        assertTrue(text.endsWith("Final Result: 14"));
        assertFalse(text.contains("Execution Time"));

        String timed = ExplanationFormatter.toText(recorder.toExplanation(), ExplanationOptions.verbose());
        assertTrue(timed.endsWith("Execution Time: 2ms"));
    }

    @Test
    @DisplayName("Should render markdown")
    void shouldRenderMarkdown() {
        Explanation explanation = explain("1d6", ExplanationOptions.defaults(), 5);

        String markdown = ExplanationFormatter.toMarkdown(explanation, ExplanationOptions.defaults());

        assertTrue(markdown.startsWith("# Expression Evaluation: `1d6`"));
        assertTrue(markdown.contains("1. **dice_roll**: Rolled 1d6: 5 (total: 5)"));
        assertTrue(markdown.contains("## Final Result: **5**"));
    }

    @Test
    @DisplayName("No-op recorder should produce an empty explanation")
    void noOpRecorderShouldRecordNothing() {
        NoOpExplanationRecorder.INSTANCE.recordFinalResult(3);

        assertTrue(NoOpExplanationRecorder.INSTANCE.toExplanation().steps().isEmpty());
    }
}
