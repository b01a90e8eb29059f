package com.spreadsheet.engine.parser.ast;

/**
 * Prefix + or - applied to an operand.
 */
public final class UnaryNode extends AstNode {
    private final Operator operator;
    private final AstNode operand;

    public UnaryNode(Operator operator, AstNode operand) {
        if (operator != Operator.ADD && operator != Operator.SUBTRACT) {
            throw new IllegalArgumentException("Not a prefix operator: " + operator.getSymbol());
        }
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public AstNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return "unary(" + operator.getSymbol() + ", " + operand + ")";
    }
}
