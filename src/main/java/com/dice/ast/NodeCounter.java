package com.dice.ast;

/**
 * Counts the nodes of an expression tree.
 */
public final class NodeCounter implements NodeVisitor<Integer> {

    private static final NodeCounter INSTANCE = new NodeCounter();

    private NodeCounter() {
    }

    public static int count(DiceNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public Integer visitNumber(NumberLiteral node) {
        return 1;
    }

    @Override
    public Integer visitDice(DiceRoll node) {
        return 1;
    }

    @Override
    public Integer visitBinary(BinaryOp node) {
        return 1 + node.left().accept(this) + node.right().accept(this);
    }

    @Override
    public Integer visitParentheses(Parentheses node) {
        return 1 + node.inner().accept(this);
    }

    @Override
    public Integer visitConditional(ConditionalDice node) {
        return 1;
    }

    @Override
    public Integer visitReroll(RerollDice node) {
        return 1;
    }
}
