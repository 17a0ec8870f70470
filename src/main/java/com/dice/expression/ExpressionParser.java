package com.dice.expression;

import com.dice.ast.ArithmeticOperator;
import com.dice.ast.BinaryOp;
import com.dice.ast.DiceNode;
import com.dice.ast.NumberLiteral;
import com.dice.ast.Parentheses;
import com.dice.exception.ParseException;

import java.util.List;

/**
 * Parser for dice expressions.
 * Converts tokens into a {@link DiceNode} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: {@code * /} over {@code + -}, both left-associative):
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := primary (('*' | '/') primary)*
 * primary    := NUMBER | DICE | CONDITIONAL_DICE | REROLL_DICE | '(' expression ')'
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;
    private int depth;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
        this.depth = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws ParseException if the tokens do not form a complete expression
     */
    public DiceNode parse() {
        if (isAtEnd()) {
            throw error("Empty expression", peek());
        }
        if (check(TokenType.OPERATOR)) {
            throw error("Expression cannot start with an operator", peek());
        }
        Token last = tokens.get(tokens.size() - 2);
        if (last.type() == TokenType.OPERATOR) {
            throw error("Expression cannot end with an operator", last);
        }

        DiceNode result = parseExpression();

        if (!isAtEnd()) {
            Token leftover = peek();
            if (leftover.type() == TokenType.RPAREN) {
                throw error("Unmatched closing parenthesis", leftover);
            }
            throw error("Unexpected token '" + leftover.text() + "'", leftover);
        }
        return result;
    }

    private DiceNode parseExpression() {
        DiceNode left = parseTerm();

        while (checkOperator(false)) {
            ArithmeticOperator operator = (ArithmeticOperator) advance().literal();
            DiceNode right = parseTerm();
            left = new BinaryOp(operator, left, right);
        }

        return left;
    }

    private DiceNode parseTerm() {
        DiceNode left = parsePrimary();

        while (checkOperator(true)) {
            ArithmeticOperator operator = (ArithmeticOperator) advance().literal();
            DiceNode right = parsePrimary();
            left = new BinaryOp(operator, left, right);
        }

        return left;
    }

    private DiceNode parsePrimary() {
        Token token = peek();

        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new NumberLiteral((Long) token.literal());
            }
            case DICE, CONDITIONAL_DICE, REROLL_DICE -> {
                advance();
                return (DiceNode) token.literal();
            }
            case LPAREN -> {
                return parseGroup();
            }
            case RPAREN -> {
                if (depth == 0) {
                    throw error("Unmatched closing parenthesis", token);
                }
                throw error("Expected an operand before ')'", token);
            }
            case OPERATOR -> {
                ArithmeticOperator operator = (ArithmeticOperator) token.literal();
                if (operator.isMultiplicative()) {
                    throw error("Unexpected operator '" + token.text() + "'", token);
                }
                throw error("Unary operators are not supported", token);
            }
            case EOF -> throw error("Unexpected end of expression", token);
            default -> throw error("Unexpected token '" + token.text() + "'", token);
        }
    }

    private DiceNode parseGroup() {
        Token open = advance();
        depth++;

        if (check(TokenType.RPAREN)) {
            throw error("Empty parenthesis group", open);
        }

        DiceNode inner = parseExpression();

        if (!check(TokenType.RPAREN)) {
            if (isAtEnd()) {
                throw error("Unmatched opening parenthesis", open);
            }
            throw error("Expected ')' but found '" + peek().text() + "'", peek());
        }
        advance();
        depth--;
        return new Parentheses(inner);
    }

    private boolean checkOperator(boolean multiplicative) {
        if (!check(TokenType.OPERATOR)) {
            return false;
        }
        ArithmeticOperator operator = (ArithmeticOperator) peek().literal();
        return operator.isMultiplicative() == multiplicative;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ParseException error(String message, Token token) {
        int position = token.position();
        String text = token.type() == TokenType.EOF ? null : token.text();
        return new ParseException("Invalid dice expression at position "
                + position + ": " + message + " in '" + input + "'", position, text);
    }
}
