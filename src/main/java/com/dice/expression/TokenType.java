package com.dice.expression;

/**
 * Token types for dice expression parsing.
 */
public enum TokenType {
    // Literals
    NUMBER,
    DICE,
    CONDITIONAL_DICE,
    REROLL_DICE,

    // Arithmetic
    OPERATOR,

    // Delimiters
    LPAREN,
    RPAREN,

    // Special
    EOF
}
