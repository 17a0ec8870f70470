package com.dice.expression;

import com.dice.ast.DiceNode;
import com.dice.exception.ValidationException;

import java.util.List;

/**
 * Facade for reading dice expressions into {@link DiceNode} trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Constants: {@code 5}</li>
 *   <li>Dice: {@code 3d6}, {@code d20}, {@code 2D8}</li>
 *   <li>Conditional dice: {@code 4d6>3}, {@code 5d10>=8}, {@code 3d6==6}</li>
 *   <li>Reroll dice: {@code 2d6r1} (exploding), {@code 4d6ro<2} (once), {@code 3d8rr1} (recursive)</li>
 *   <li>Arithmetic: {@code + - * /} and parentheses</li>
 * </ul>
 * <p>
 * Precedence: {@code * /} over {@code + -} (parentheses override)
 */
public class DiceExpressionParser {

    private final DiceLimits limits;

    public DiceExpressionParser(DiceLimits limits) {
        this.limits = limits;
    }

    public DiceExpressionParser() {
        this(DiceLimits.defaults());
    }

    /**
     * Parse an expression into tokens and a tree.
     *
     * @param expression Expression string, whitespace allowed
     * @return Parsed expression
     */
    public ParsedExpression read(String expression) {
        String normalized = normalize(expression);
        List<Token> tokens = tokenize(normalized);
        DiceNode ast = new ExpressionParser(normalized, tokens).parse();
        return new ParsedExpression(expression, normalized, tokens, ast);
    }

    /**
     * Parse an expression into a tree.
     *
     * @param expression Expression string
     * @return Root node
     */
    public DiceNode parse(String expression) {
        return read(expression).ast();
    }

    /**
     * Tokenize an already normalized expression.
     *
     * @param normalized Expression with whitespace removed
     * @return Tokens including the trailing EOF
     */
    public List<Token> tokenize(String normalized) {
        return new ExpressionTokenizer(normalized, limits).tokenize();
    }

    /**
     * Check the length limit and strip whitespace.
     * Runs before any pattern matching so an oversized input never reaches the tokenizer.
     */
    public String normalize(String expression) {
        if (expression == null) {
            throw new ValidationException("Expression must not be null", 0);
        }
        if (expression.length() > limits.maxExpressionLength()) {
            throw new ValidationException("Expression too long: " + expression.length()
                    + " characters (maximum " + limits.maxExpressionLength() + ")", 0);
        }
        return ExpressionConfig.WHITESPACE.matcher(expression).replaceAll("");
    }

    public DiceLimits getLimits() {
        return limits;
    }
}
