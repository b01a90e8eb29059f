package com.spreadsheet.engine.values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular block of values, stored row-major.
 *
 * Produced when a range is evaluated (A1:B3) and by functions such as INDEX
 * with a zero row or column. Arrays only live inside an evaluation; a cell whose
 * formula yields an array stores the top-left element.
 */
public final class ArrayValue extends Value {

    private final int rows;
    private final int columns;
    private final List<Value> values;

    public ArrayValue(int rows, int columns, List<Value> values) {
        if (rows * columns != values.size()) {
            throw new IllegalArgumentException(
                    "Array of " + rows + "x" + columns + " cannot hold " + values.size() + " values");
        }
        this.rows = rows;
        this.columns = columns;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ArrayValue column(List<Value> values) {
        return new ArrayValue(values.size(), 1, values);
    }

    public static ArrayValue row(List<Value> values) {
        return new ArrayValue(1, values.size(), values);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @param row 0-based row
     * @param column 0-based column
     */
    public Value get(int row, int column) {
        return values.get(row * columns + column);
    }

    public List<Value> getRow(int row) {
        return values.subList(row * columns, (row + 1) * columns);
    }

    public List<Value> getColumn(int column) {
        List<Value> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(get(r, column));
        }
        return result;
    }

    /** All values in row-major order. */
    public List<Value> getValues() {
        return values;
    }

    public Value first() {
        return values.isEmpty() ? EmptyValue.INSTANCE : values.get(0);
    }

    @Override
    public ValueType getType() {
        return ValueType.ARRAY;
    }

    @Override
    public Object toJson() {
        List<Object> json = new ArrayList<>(values.size());
        for (Value value : values) {
            json.add(value.toJson());
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArrayValue)) {
            return false;
        }
        ArrayValue other = (ArrayValue) o;
        return rows == other.rows && columns == other.columns && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + values.hashCode();
    }

    @Override
    public String toString() {
        return "Array" + rows + "x" + columns + values;
    }
}
