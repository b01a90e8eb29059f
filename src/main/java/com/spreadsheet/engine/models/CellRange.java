package com.spreadsheet.engine.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular block of cells given by two corners in any order.
 * Member cells are enumerated row-major: A1, B1, A2, B2 for A1:B2.
 */
public final class CellRange {

    private final CellId topLeft;
    private final CellId bottomRight;

    public CellRange(CellId start, CellId end) {
        this.topLeft = CellId.of(
                Math.min(start.getColumn(), end.getColumn()),
                Math.min(start.getRow(), end.getRow()));
        this.bottomRight = CellId.of(
                Math.max(start.getColumn(), end.getColumn()),
                Math.max(start.getRow(), end.getRow()));
    }

    public static CellRange parse(String start, String end) {
        return new CellRange(CellId.parse(start), CellId.parse(end));
    }

    public CellId getTopLeft() {
        return topLeft;
    }

    public CellId getBottomRight() {
        return bottomRight;
    }

    public int rowCount() {
        return bottomRight.getRow() - topLeft.getRow() + 1;
    }

    public int columnCount() {
        return bottomRight.getColumn() - topLeft.getColumn() + 1;
    }

    public List<CellId> cells() {
        List<CellId> cells = new ArrayList<>(rowCount() * columnCount());
        for (int r = topLeft.getRow(); r <= bottomRight.getRow(); r++) {
            for (int c = topLeft.getColumn(); c <= bottomRight.getColumn(); c++) {
                cells.add(CellId.of(c, r));
            }
        }
        return cells;
    }

    public boolean contains(CellId cell) {
        return cell.getColumn() >= topLeft.getColumn() && cell.getColumn() <= bottomRight.getColumn()
                && cell.getRow() >= topLeft.getRow() && cell.getRow() <= bottomRight.getRow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
    }

    @Override
    public int hashCode() {
        return 31 * topLeft.hashCode() + bottomRight.hashCode();
    }

    @Override
    public String toString() {
        return topLeft + ":" + bottomRight;
    }
}
