package com.spreadsheet.engine.values;

import java.math.BigDecimal;

/**
 * A numeric cell value. Dates and times are numbers too (serial dates).
 */
public final class NumberValue extends Value {

    private final double number;

    public NumberValue(double number) {
        this.number = number;
    }

    public double getNumber() {
        return number;
    }

    @Override
    public ValueType getType() {
        return ValueType.NUMBER;
    }

    @Override
    public Object toJson() {
        return number;
    }

    /**
     * Renders the number the way a spreadsheet shows it in text context:
     * integral values without a fractional part ("5", not "5.0").
     */
    public static String format(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumberValue)) {
            return false;
        }
        return Double.compare(number, ((NumberValue) o).number) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(number);
    }

    @Override
    public String toString() {
        return format(number);
    }
}
