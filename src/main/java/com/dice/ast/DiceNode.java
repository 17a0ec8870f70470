package com.dice.ast;

/**
 * Node of a parsed dice expression.
 * <p>
 * The set of node types is closed; consumers dispatch through {@link NodeVisitor},
 * so a new node type must be handled by every visitor before the code compiles.
 */
public sealed interface DiceNode
        permits NumberLiteral, DiceRoll, BinaryOp, Parentheses, ConditionalDice, RerollDice {

    <T> T accept(NodeVisitor<T> visitor);

    /**
     * Render this node back to canonical dice notation.
     */
    String toNotation();
}
