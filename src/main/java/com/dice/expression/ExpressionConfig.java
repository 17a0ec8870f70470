package com.dice.expression;

import java.util.regex.Pattern;

/**
 * Token patterns and symbols for dice expressions.
 * <p>
 * Dice patterns are tried most-specific first: conditional dice, then reroll dice,
 * then plain dice. A plain dice match on {@code 4d6>3} would otherwise leave
 * {@code >3} unmatched.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * {@code [count]d<sides><op><threshold>}, e.g. {@code 4d6>=5}.
     */
    public static final Pattern CONDITIONAL_DICE =
            Pattern.compile("(\\d*)[dD](\\d+)(<=|>=|==|<|>|=)(\\d+)");

    /**
     * {@code [count]d<sides>r[o|r][op]<threshold>}, e.g. {@code 2d6r1}, {@code 4d6ro<2}.
     */
    public static final Pattern REROLL_DICE =
            Pattern.compile("(\\d*)[dD](\\d+)r([or]?)(<=|>=|<|>|=)?(\\d+)");

    /**
     * {@code [count]d<sides>}, e.g. {@code 3d6}, {@code d20}.
     */
    public static final Pattern DICE =
            Pattern.compile("(\\d*)[dD](\\d+)");

    public static final Pattern NUMBER = Pattern.compile("\\d+");

    public static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Dice count used when the count before {@code d} is omitted.
     */
    public static final int IMPLICIT_DICE_COUNT = 1;

    /**
     * Reroll comparison used when none is written, so {@code r1} means "reroll on 1".
     */
    public static final String DEFAULT_REROLL_OPERATOR = "=";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char MULTIPLY = '*';
        public static final char DIVIDE = '/';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Operators() {
        }
    }
}
