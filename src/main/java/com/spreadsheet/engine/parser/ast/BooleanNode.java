package com.spreadsheet.engine.parser.ast;

public final class BooleanNode extends AstNode {
    private final boolean value;

    public BooleanNode(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String toString() {
        return "boolean(" + value + ")";
    }
}
