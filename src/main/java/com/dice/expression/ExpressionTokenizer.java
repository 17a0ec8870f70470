package com.dice.expression;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.ComparisonOperator;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceRoll;
import com.dice.ast.RerollDice;
import com.dice.ast.RerollType;
import com.dice.exception.TokenizationException;
import com.dice.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.dice.expression.ExpressionConfig.*;

/**
 * Tokenizer for dice expressions.
 * Converts a whitespace-stripped expression into a sequence of tokens ending with {@link TokenType#EOF}.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private final DiceLimits limits;
    private int pos;

    public ExpressionTokenizer(String input, DiceLimits limits) {
        this.input = input;
        this.length = input.length();
        this.limits = limits;
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by an EOF token
     * @throws TokenizationException on the first span no pattern matches
     * @throws ValidationException   when a dice term is outside the configured limits
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();
            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.PLUS, Operators.MINUS, Operators.MULTIPLY, Operators.DIVIDE -> {
                    advance();
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c),
                            ArithmeticOperator.fromSymbol(c), start));
                }
                default -> tokens.add(readOperand());
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readOperand() {
        Matcher conditional = matchAt(CONDITIONAL_DICE);
        if (conditional != null) {
            return readConditionalDice(conditional);
        }

        Matcher reroll = matchAt(REROLL_DICE);
        if (reroll != null) {
            return readRerollDice(reroll);
        }

        Matcher dice = matchAt(DICE);
        if (dice != null) {
            return readDice(dice);
        }

        Matcher number = matchAt(NUMBER);
        if (number != null) {
            return readNumber(number);
        }

        throw error("Invalid dice expression syntax", pos);
    }

    private Token readDice(Matcher matcher) {
        int start = pos;
        int count = parseCount(matcher.group(1), start);
        int sides = parseSides(matcher.group(2), start);
        return consume(matcher, TokenType.DICE, new DiceRoll(count, sides));
    }

    private Token readConditionalDice(Matcher matcher) {
        int start = pos;
        int count = parseCount(matcher.group(1), start);
        int sides = parseSides(matcher.group(2), start);
        ComparisonOperator operator = ComparisonOperator.fromSymbol(matcher.group(3));
        int threshold = parseThreshold(matcher.group(4), sides, start);
        return consume(matcher, TokenType.CONDITIONAL_DICE,
                new ConditionalDice(count, sides, operator, threshold));
    }

    private Token readRerollDice(Matcher matcher) {
        int start = pos;
        int count = parseCount(matcher.group(1), start);
        int sides = parseSides(matcher.group(2), start);
        RerollType type = RerollType.fromMarker(matcher.group(3));
        String op = matcher.group(4) != null ? matcher.group(4) : DEFAULT_REROLL_OPERATOR;
        ComparisonOperator condition = ComparisonOperator.fromSymbol(op);
        int threshold = parseThreshold(matcher.group(5), sides, start);
        return consume(matcher, TokenType.REROLL_DICE,
                new RerollDice(count, sides, type, condition, threshold));
    }

    private Token readNumber(Matcher matcher) {
        int start = pos;
        String text = matcher.group();
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
        return consume(matcher, TokenType.NUMBER, value);
    }

    private Token consume(Matcher matcher, TokenType type, Object literal) {
        int start = pos;
        pos = matcher.end();
        return new Token(type, input.substring(start, pos), literal, start);
    }

    private int parseCount(String digits, int position) {
        if (digits.isEmpty()) {
            return IMPLICIT_DICE_COUNT;
        }
        long count = parseBounded(digits);
        if (count <= 0) {
            throw invalid("At least one die is required, got " + count + " dice", position);
        }
        if (count > limits.maxDiceCount()) {
            throw invalid("Dice count " + digits + " exceeds maximum of " + limits.maxDiceCount(), position);
        }
        return (int) count;
    }

    private int parseSides(String digits, int position) {
        long sides = parseBounded(digits);
        if (sides <= 0) {
            throw invalid("A die needs at least one side, got " + sides, position);
        }
        if (sides > limits.maxDiceSides()) {
            throw invalid("Dice sides " + digits + " exceed maximum of " + limits.maxDiceSides(), position);
        }
        return (int) sides;
    }

    private int parseThreshold(String digits, int sides, int position) {
        long threshold = parseBounded(digits);
        if (threshold > sides + 1L) {
            throw invalid("Threshold " + digits + " is outside the range 0.." + (sides + 1)
                    + " for a d" + sides, position);
        }
        return (int) threshold;
    }

    /**
     * Parse a digit run, saturating at {@code Long.MAX_VALUE} so limit checks report it as too large.
     */
    private long parseBounded(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private Matcher matchAt(Pattern pattern) {
        Matcher matcher = pattern.matcher(input);
        matcher.region(pos, length);
        return matcher.lookingAt() ? matcher : null;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private TokenizationException error(String message, int position) {
        String fragment = input.substring(position);
        return new TokenizationException("Invalid dice expression at position "
                + position + ": " + message + " near '" + fragment + "' in '" + input + "'",
                position, fragment);
    }

    private ValidationException invalid(String message, int position) {
        return new ValidationException("Invalid dice expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
