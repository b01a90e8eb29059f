package com.spreadsheet.engine.parser.ast;

import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.models.CellRange;

/**
 * A rectangular range reference such as A1:B3. Endpoints are always normalized ids.
 */
public final class RangeNode extends AstNode {
    private final CellId start;
    private final CellId end;

    public RangeNode(CellId start, CellId end) {
        this.start = start;
        this.end = end;
    }

    public CellId getStart() {
        return start;
    }

    public CellId getEnd() {
        return end;
    }

    public CellRange toRange() {
        return new CellRange(start, end);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public String toString() {
        return "range(" + start + ":" + end + ")";
    }
}
