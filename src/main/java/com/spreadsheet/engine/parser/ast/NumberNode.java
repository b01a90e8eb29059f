package com.spreadsheet.engine.parser.ast;

public final class NumberNode extends AstNode {
    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return "number(" + value + ")";
    }
}
