package com.dice.ast;

/**
 * Visitor over the closed set of {@link DiceNode} types.
 *
 * @param <T> Result type of the visit
 */
public interface NodeVisitor<T> {

    T visitNumber(NumberLiteral node);

    T visitDice(DiceRoll node);

    T visitBinary(BinaryOp node);

    T visitParentheses(Parentheses node);

    T visitConditional(ConditionalDice node);

    T visitReroll(RerollDice node);
}
