package com.spreadsheet.engine.parser.ast;

public final class StringNode extends AstNode {
    private final String value;

    public StringNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "string(\"" + value + "\")";
    }
}
