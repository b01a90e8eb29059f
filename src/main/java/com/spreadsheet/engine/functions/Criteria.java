package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.Value;

import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Criteria of SUMIF / COUNTIF / AVERAGEIF, e.g. ">20", "<>0", "Apple", 5.
 *
 * A leading comparison operator compares numerically when its operand is a number
 * (only numeric cells can then match, except for "<>"), otherwise as text.
 * Without an operator the test is an exact, case-insensitive match; "*" and "?"
 * are ordinary characters.
 */
public final class Criteria {

    private static final Pattern COMPARISON = Pattern.compile("^(>=|<=|<>|>|<|=)(.*)$", Pattern.DOTALL);

    private Criteria() {
    }

    public static Predicate<Value> parse(Value criteria, TypeCoercion coercion) {
        Value criterion = coercion.scalar(criteria);
        if (criterion.isNumber()) {
            double target = coercion.toNumber(criterion);
            return value -> coercion.isNumberLike(value) && coercion.toNumber(value) == target;
        }
        if (criterion.isBoolean()) {
            boolean target = ((BooleanValue) criterion).getBoolean();
            return value -> value.isBoolean() && ((BooleanValue) value).getBoolean() == target;
        }

        String text = coercion.toText(criterion);
        Matcher matcher = COMPARISON.matcher(text);
        if (matcher.matches()) {
            return comparison(matcher.group(1), matcher.group(2).trim(), coercion);
        }
        if (coercion.isNumeric(text)) {
            double target = Double.parseDouble(text.trim());
            return value -> coercion.isNumberLike(value) && coercion.toNumber(value) == target;
        }
        return value -> coercion.toText(value).equalsIgnoreCase(text);
    }

    private static Predicate<Value> comparison(String operator, String operand, TypeCoercion coercion) {
        if (coercion.isNumeric(operand)) {
            double target = Double.parseDouble(operand);
            if (operator.equals("<>")) {
                return value -> !coercion.isNumberLike(value) || coercion.toNumber(value) != target;
            }
            return value -> coercion.isNumberLike(value) && test(operator, Double.compare(coercion.toNumber(value), target));
        }
        switch (operator) {
            case "=":
                return value -> coercion.toText(value).equalsIgnoreCase(operand);
            case "<>":
                return value -> !coercion.toText(value).equalsIgnoreCase(operand);
            default:
                Value target = Value.of(operand);
                return value -> !value.isEmpty() && !coercion.isNumberLike(value)
                        && test(operator, coercion.compare(value, target));
        }
    }

    private static boolean test(String operator, int order) {
        switch (operator) {
            case ">":
                return order > 0;
            case "<":
                return order < 0;
            case ">=":
                return order >= 0;
            case "<=":
                return order <= 0;
            case "<>":
                return order != 0;
            default:
                return order == 0;
        }
    }
}
