package com.dice.engine;

/**
 * Output formats for rendered explanations.
 */
public enum ExplanationFormat {
    TEXT,
    MARKDOWN
}
