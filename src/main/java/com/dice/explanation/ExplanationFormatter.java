package com.dice.explanation;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an {@link Explanation} as plain text or markdown.
 */
public final class ExplanationFormatter {

    private static final String TOKEN_SEPARATOR = " -> ";

    private ExplanationFormatter() {
    }

    public static String toText(Explanation explanation, ExplanationOptions options) {
        List<String> lines = new ArrayList<>();

        lines.add("Expression: " + explanation.originalExpression());
        lines.add("");

        if (options.includeTokenization() && !explanation.tokenization().isEmpty()) {
            lines.add("Tokenization: " + String.join(TOKEN_SEPARATOR, explanation.tokenization()));
            lines.add("");
        }

        if (options.includeParsing() && !explanation.parsing().isEmpty()) {
            lines.add("Parsing: " + explanation.parsing());
            lines.add("");
        }

        lines.add("Evaluation Steps:");
        for (EvaluationStep step : explanation.steps()) {
            lines.add("  " + step.step() + ". " + step.description());
            if (step.hasDetails() && options.verboseMode()) {
                lines.add("     Details: " + step.details());
            }
        }

        lines.add("");
        lines.add("Final Result: " + explanation.finalResult());

        if (explanation.executionTimeMs() != null && options.includeTimings()) {
            lines.add("Execution Time: " + explanation.executionTimeMs() + "ms");
        }

        return String.join("\n", lines);
    }

    public static String toMarkdown(Explanation explanation, ExplanationOptions options) {
        List<String> lines = new ArrayList<>();

        lines.add("# Expression Evaluation: `" + explanation.originalExpression() + "`");
        lines.add("");

        if (options.includeTokenization() && !explanation.tokenization().isEmpty()) {
            lines.add("## Tokenization");
            lines.add("`" + String.join(TOKEN_SEPARATOR, explanation.tokenization()) + "`");
            lines.add("");
        }

        if (options.includeParsing() && !explanation.parsing().isEmpty()) {
            lines.add("## Parsing");
            lines.add(explanation.parsing());
            lines.add("");
        }

        lines.add("## Evaluation Steps");
        for (EvaluationStep step : explanation.steps()) {
            lines.add(step.step() + ". **" + step.type().displayName() + "**: " + step.description());
            if (step.hasDetails() && options.verboseMode()) {
                lines.add("   - *" + step.details() + "*");
            }
        }

        lines.add("");
        lines.add("## Final Result: **" + explanation.finalResult() + "**");

        if (explanation.executionTimeMs() != null && options.includeTimings()) {
            lines.add("*Execution Time: " + explanation.executionTimeMs() + "ms*");
        }

        return String.join("\n", lines);
    }
}
