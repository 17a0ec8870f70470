package com.dice.expression;

import com.dice.ast.DiceNode;

import java.util.List;

/**
 * Result of reading one expression: its tokens and the tree built from them.
 *
 * @param source     Expression as supplied by the caller
 * @param normalized Expression with whitespace removed; token positions refer to this text
 * @param tokens     Tokens including the trailing EOF
 * @param ast        Root node
 */
public record ParsedExpression(String source, String normalized, List<Token> tokens, DiceNode ast) {

    public ParsedExpression {
        tokens = List.copyOf(tokens);
    }

    /**
     * Token texts in order, without the EOF sentinel.
     */
    public List<String> tokenTexts() {
        return tokens.stream()
                .filter(t -> t.type() != TokenType.EOF)
                .map(Token::text)
                .toList();
    }
}
