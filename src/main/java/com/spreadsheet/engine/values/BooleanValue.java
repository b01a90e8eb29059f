package com.spreadsheet.engine.values;

/**
 * A logical cell value. Only two instances exist.
 */
public final class BooleanValue extends Value {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean bool;

    private BooleanValue(boolean bool) {
        this.bool = bool;
    }

    public boolean getBoolean() {
        return bool;
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
    }

    @Override
    public Object toJson() {
        return bool;
    }

    @Override
    public String toString() {
        return bool ? "TRUE" : "FALSE";
    }
}
