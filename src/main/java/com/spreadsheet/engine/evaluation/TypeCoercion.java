package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.Value;
import com.spreadsheet.engine.values.ValueType;

import java.text.Collator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts values between number, text and boolean the way a spreadsheet does.
 *
 * Stateless apart from the collator used for text ordering; one instance is shared
 * by every evaluation and handed to builtin functions through their {@link EvalContext}.
 */
public class TypeCoercion {

    // Whole-string number: "-12", "3.", ".5", "1e3"
    private static final Pattern NUMERIC = Pattern.compile("^-?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private final Collator collator;

    public TypeCoercion() {
        this(Locale.ENGLISH);
    }

    public TypeCoercion(Locale locale) {
        this.collator = Collator.getInstance(locale);
        // Case-insensitive, as spreadsheet text comparison is
        this.collator.setStrength(Collator.SECONDARY);
    }

    /**
     * Classifies raw (non-formula) cell input:
     * blank -> empty, numeric text -> number, TRUE/FALSE -> boolean, else text.
     */
    public Value parseInput(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Value.empty();
        }
        if (isNumeric(raw)) {
            return Value.of(Double.parseDouble(raw.trim()));
        }
        if (raw.equalsIgnoreCase("TRUE")) {
            return BooleanValue.TRUE;
        }
        if (raw.equalsIgnoreCase("FALSE")) {
            return BooleanValue.FALSE;
        }
        return Value.of(raw);
    }

    /**
     * True if the whole (trimmed) text is a plain decimal number.
     */
    public boolean isNumeric(String text) {
        return text != null && NUMERIC.matcher(text.trim()).matches();
    }

    /**
     * True for numbers and for text that reads as a number.
     */
    public boolean isNumberLike(Value value) {
        if (value instanceof NumberValue) {
            return true;
        }
        return value instanceof TextValue && isNumeric(((TextValue) value).getText());
    }

    /**
     * Converts a value to a number.
     * - Booleans: TRUE=1, FALSE=0
     * - Text: parsed if the whole string is numeric, otherwise 0
     * - Blank: 0
     * - Arrays: the first element
     * - Errors: 0 (callers that care check for errors first)
     */
    public double toNumber(Value value) {
        switch (value.getType()) {
            case NUMBER:
                return ((NumberValue) value).getNumber();
            case BOOLEAN:
                return ((BooleanValue) value).getBoolean() ? 1 : 0;
            case TEXT:
                String text = ((TextValue) value).getText();
                return isNumeric(text) ? Double.parseDouble(text.trim()) : 0;
            case ARRAY:
                return toNumber(((ArrayValue) value).first());
            default:
                return 0;
        }
    }

    /**
     * Converts a value to text.
     * - Booleans: "TRUE" / "FALSE"
     * - Numbers: without a trailing ".0" for whole numbers
     * - Blank: ""
     * - Errors: their code, e.g. "#N/A"
     */
    public String toText(Value value) {
        switch (value.getType()) {
            case TEXT:
                return ((TextValue) value).getText();
            case NUMBER:
                return NumberValue.format(((NumberValue) value).getNumber());
            case BOOLEAN:
                return ((BooleanValue) value).getBoolean() ? "TRUE" : "FALSE";
            case ERROR:
                return ((FormulaError) value).getCode();
            case ARRAY:
                return toText(((ArrayValue) value).first());
            default:
                return "";
        }
    }

    /**
     * Converts a value to a boolean.
     * - Numbers: 0 is FALSE, anything else TRUE
     * - Text: "" is FALSE, any other text (even "FALSE") is TRUE
     * - Blank: FALSE
     */
    public boolean toBoolean(Value value) {
        switch (value.getType()) {
            case BOOLEAN:
                return ((BooleanValue) value).getBoolean();
            case NUMBER:
                return ((NumberValue) value).getNumber() != 0;
            case TEXT:
                return !((TextValue) value).getText().isEmpty();
            case ARRAY:
                return toBoolean(((ArrayValue) value).first());
            case EMPTY:
                return false;
            default:
                return true;
        }
    }

    /**
     * Orders two values: 0 if equal, negative if a < b, positive if a > b.
     * Same types compare directly (text by locale collation); mixed types compare
     * numerically when both sides read as numbers, otherwise as text.
     */
    public int compare(Value a, Value b) {
        a = scalar(a);
        b = scalar(b);
        // Blank takes the type of the other side
        if (a.isEmpty() && !b.isEmpty()) {
            a = blankAs(b.getType());
        } else if (b.isEmpty() && !a.isEmpty()) {
            b = blankAs(a.getType());
        }

        if (a.getType() == b.getType()) {
            switch (a.getType()) {
                case NUMBER:
                case BOOLEAN:
                    return Double.compare(toNumber(a) + 0.0, toNumber(b) + 0.0);
                case EMPTY:
                    return 0;
                default:
                    return collator.compare(toText(a), toText(b));
            }
        }
        if (isNumericOperand(a) && isNumericOperand(b)) {
            return Double.compare(toNumber(a) + 0.0, toNumber(b) + 0.0);
        }
        return collator.compare(toText(a), toText(b));
    }

    /**
     * Expands array arguments into their elements, keeping scalar order.
     */
    public List<Value> flatten(List<Value> values) {
        List<Value> flat = new ArrayList<>();
        for (Value value : values) {
            if (value instanceof ArrayValue) {
                flat.addAll(((ArrayValue) value).getValues());
            } else {
                flat.add(value);
            }
        }
        return flat;
    }

    /**
     * Reduces an array to its first element; other values pass through.
     */
    public Value scalar(Value value) {
        return value instanceof ArrayValue ? ((ArrayValue) value).first() : value;
    }

    private boolean isNumericOperand(Value value) {
        return value.isNumber() || value.isBoolean() || isNumberLike(value);
    }

    private static Value blankAs(ValueType type) {
        switch (type) {
            case NUMBER:
                return Value.of(0);
            case BOOLEAN:
                return BooleanValue.FALSE;
            default:
                return Value.of("");
        }
    }
}
