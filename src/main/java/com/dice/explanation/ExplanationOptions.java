package com.dice.explanation;

/**
 * Controls which steps are recorded and how much detail is rendered.
 *
 * @param includeTokenization      Record the token list
 * @param includeParsing           Record the parsing summary
 * @param includeIntermediateSteps Record per-node evaluation steps
 * @param includeDiceDetails       Attach individual die faces to dice steps
 * @param includeTimings           Render the execution time
 * @param verboseMode              Attach and render explanatory details on every step
 */
public record ExplanationOptions(
        boolean includeTokenization,
        boolean includeParsing,
        boolean includeIntermediateSteps,
        boolean includeDiceDetails,
        boolean includeTimings,
        boolean verboseMode
) {
    public static ExplanationOptions defaults() {
        return new ExplanationOptions(true, true, true, true, false, false);
    }

    public static ExplanationOptions verbose() {
        return new ExplanationOptions(true, true, true, true, true, true);
    }
}
