package com.spreadsheet.engine.parser.ast;

import com.spreadsheet.engine.models.CellId;

/**
 * A single-cell reference. Keeps the reference as written ("$A$1")
 * next to the normalized id used for lookups.
 */
public final class CellNode extends AstNode {
    private final String reference;
    private final CellId cell;

    public CellNode(String reference) {
        this.reference = reference;
        this.cell = CellId.parse(reference);
    }

    public String getReference() {
        return reference;
    }

    public CellId getCell() {
        return cell;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCell(this);
    }

    @Override
    public String toString() {
        return "cell(" + reference + ")";
    }
}
