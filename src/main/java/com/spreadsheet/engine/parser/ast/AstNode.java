package com.spreadsheet.engine.parser.ast;

/**
 * A node of a parsed formula. Trees are immutable and owned by the cell that holds them.
 */
public abstract class AstNode {

    public abstract <R> R accept(AstVisitor<R> visitor);
}
