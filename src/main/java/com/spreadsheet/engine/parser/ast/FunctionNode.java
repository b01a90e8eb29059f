package com.spreadsheet.engine.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * A function call. Arguments are ordered and may include range nodes.
 */
public final class FunctionNode extends AstNode {
    private final String name;
    private final List<AstNode> arguments;

    public FunctionNode(String name, List<AstNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        return "function(" + name + ", " + arguments + ")";
    }
}
