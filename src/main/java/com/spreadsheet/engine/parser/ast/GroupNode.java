package com.spreadsheet.engine.parser.ast;

/**
 * A parenthesized sub-expression.
 */
public final class GroupNode extends AstNode {
    private final AstNode expression;

    public GroupNode(AstNode expression) {
        this.expression = expression;
    }

    public AstNode getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return "group(" + expression + ")";
    }
}
