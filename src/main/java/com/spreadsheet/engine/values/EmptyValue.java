package com.spreadsheet.engine.values;

/**
 * The value of a cell that has never been set or has been cleared.
 */
public final class EmptyValue extends Value {

    public static final EmptyValue INSTANCE = new EmptyValue();

    private EmptyValue() {
    }

    @Override
    public ValueType getType() {
        return ValueType.EMPTY;
    }

    @Override
    public Object toJson() {
        return null;
    }

    @Override
    public String toString() {
        return "";
    }
}
