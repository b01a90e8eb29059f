package com.spreadsheet.engine.values;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Base type for everything a cell can hold or a formula can produce:
 * numbers, text, booleans, blanks, spreadsheet errors and (during evaluation only) arrays.
 *
 * Values are immutable. Spreadsheet errors are ordinary values (see {@link FormulaError}),
 * so "a function returned #DIV/0!" and "a function returned 42" look the same to callers.
 */
public abstract class Value {

    public abstract ValueType getType();

    /**
     * Plain Java representation used when serializing update sets:
     * Double, String, Boolean, null for blanks, the error code for errors.
     */
    @JsonValue
    public abstract Object toJson();

    public boolean isError() {
        return getType() == ValueType.ERROR;
    }

    public boolean isEmpty() {
        return getType() == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return getType() == ValueType.NUMBER;
    }

    public boolean isText() {
        return getType() == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return getType() == ValueType.BOOLEAN;
    }

    public boolean isArray() {
        return getType() == ValueType.ARRAY;
    }

    // Factories

    public static NumberValue of(double number) {
        return new NumberValue(number);
    }

    public static TextValue of(String text) {
        return new TextValue(text);
    }

    public static BooleanValue of(boolean bool) {
        return bool ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    public static EmptyValue empty() {
        return EmptyValue.INSTANCE;
    }
}
