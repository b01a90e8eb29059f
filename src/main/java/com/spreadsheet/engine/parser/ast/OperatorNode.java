package com.spreadsheet.engine.parser.ast;

/**
 * A binary operation: arithmetic, concatenation or comparison.
 */
public final class OperatorNode extends AstNode {
    private final Operator operator;
    private final AstNode left;
    private final AstNode right;

    public OperatorNode(Operator operator, AstNode left, AstNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public AstNode getLeft() {
        return left;
    }

    public AstNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return "operator(" + operator.getSymbol() + ", " + left + ", " + right + ")";
    }
}
