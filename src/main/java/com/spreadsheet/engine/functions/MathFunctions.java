package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Predicate;

import static com.spreadsheet.engine.functions.FunctionRegistry.VARIADIC;

/**
 * Aggregates, rounding, conditional sums and elementary math.
 *
 * SUM and PRODUCT-style aggregates coerce; AVERAGE, MIN, MAX, MEDIAN, MODE, STDEV
 * and VAR only look at numbers and numeric-looking text, ignoring everything else.
 */
public final class MathFunctions {

    /** Beyond this many places either way every finite double rounds the same. */
    private static final int MAX_ROUNDING_DIGITS = 340;

    private MathFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("SUM", 1, VARIADIC, MathFunctions::sum);
        registry.register("AVERAGE", 1, VARIADIC, MathFunctions::average);
        registry.register("MIN", 1, VARIADIC, (args, ctx) -> extreme(args, ctx, true));
        registry.register("MAX", 1, VARIADIC, (args, ctx) -> extreme(args, ctx, false));
        registry.register("PRODUCT", 1, VARIADIC, MathFunctions::product);
        registry.register("MEDIAN", 1, VARIADIC, MathFunctions::median);
        registry.register("MODE", 1, VARIADIC, MathFunctions::mode);
        registry.register("STDEV", 1, VARIADIC, (args, ctx) -> variance(args, ctx, true));
        registry.register("VAR", 1, VARIADIC, (args, ctx) -> variance(args, ctx, false));
        registry.registerErrorAware("COUNT", 1, VARIADIC, MathFunctions::count);
        registry.registerErrorAware("COUNTA", 1, VARIADIC, MathFunctions::countA);
        registry.registerErrorAware("COUNTBLANK", 1, VARIADIC, MathFunctions::countBlank);

        registry.register("SUMIF", 2, 3, MathFunctions::sumIf);
        registry.register("COUNTIF", 2, 2, MathFunctions::countIf);
        registry.register("AVERAGEIF", 2, 3, MathFunctions::averageIf);
        registry.register("SUMPRODUCT", 1, VARIADIC, MathFunctions::sumProduct);

        registry.register("ROUND", 1, 2, (args, ctx) -> round(args, ctx, RoundingMode.HALF_UP));
        registry.register("ROUNDUP", 1, 2, (args, ctx) -> round(args, ctx, RoundingMode.UP));
        registry.register("ROUNDDOWN", 1, 2, (args, ctx) -> round(args, ctx, RoundingMode.DOWN));
        registry.register("TRUNC", 1, 2, (args, ctx) -> round(args, ctx, RoundingMode.DOWN));
        registry.register("INT", 1, 1, unary(Math::floor));
        registry.register("CEILING", 1, 2, (args, ctx) -> toMultiple(args, true));
        registry.register("FLOOR", 1, 2, (args, ctx) -> toMultiple(args, false));

        registry.register("ABS", 1, 1, unary(Math::abs));
        registry.register("SIGN", 1, 1, unary(Math::signum));
        registry.register("MOD", 2, 2, MathFunctions::mod);
        registry.register("POWER", 2, 2, MathFunctions::power);
        registry.register("SQRT", 1, 1, MathFunctions::sqrt);
        registry.register("EXP", 1, 1, unary(Math::exp));
        registry.register("LN", 1, 1, MathFunctions::ln);
        registry.register("LOG", 1, 2, MathFunctions::log);
        registry.register("LOG10", 1, 1, MathFunctions::log10);
        registry.register("PI", 0, 0, (args, ctx) -> Value.of(Math.PI));
        registry.register("SIN", 1, 1, unary(Math::sin));
        registry.register("COS", 1, 1, unary(Math::cos));
        registry.register("TAN", 1, 1, unary(Math::tan));
        registry.register("RADIANS", 1, 1, unary(Math::toRadians));
        registry.register("DEGREES", 1, 1, unary(Math::toDegrees));
        registry.register("RAND", 0, 0, (args, ctx) -> Value.of(ThreadLocalRandom.current().nextDouble()));
        registry.register("RANDBETWEEN", 2, 2, MathFunctions::randBetween);
    }

    // --- Aggregates ---

    private static Value sum(FunctionArgs args, EvalContext ctx) {
        double total = 0;
        for (Value value : args.flatten()) {
            total += ctx.getCoercion().toNumber(value);
        }
        return Value.of(total);
    }

    private static Value average(FunctionArgs args, EvalContext ctx) {
        List<Double> numbers = numbers(args.flatten(), ctx.getCoercion());
        if (numbers.isEmpty()) {
            return Value.of(0);
        }
        return Value.of(total(numbers) / numbers.size());
    }

    private static Value extreme(FunctionArgs args, EvalContext ctx, boolean min) {
        List<Double> numbers = numbers(args.flatten(), ctx.getCoercion());
        if (numbers.isEmpty()) {
            return Value.of(0);
        }
        return Value.of(min ? Collections.min(numbers) : Collections.max(numbers));
    }

    private static Value product(FunctionArgs args, EvalContext ctx) {
        List<Double> numbers = numbers(args.flatten(), ctx.getCoercion());
        if (numbers.isEmpty()) {
            return Value.of(0);
        }
        double result = 1;
        for (double n : numbers) {
            result *= n;
        }
        return Value.of(result);
    }

    private static Value median(FunctionArgs args, EvalContext ctx) {
        List<Double> numbers = numbers(args.flatten(), ctx.getCoercion());
        if (numbers.isEmpty()) {
            return FormulaError.num("MEDIAN has no numbers");
        }
        Collections.sort(numbers);
        int middle = numbers.size() / 2;
        if (numbers.size() % 2 == 1) {
            return Value.of(numbers.get(middle));
        }
        return Value.of((numbers.get(middle - 1) + numbers.get(middle)) / 2);
    }

    private static Value mode(FunctionArgs args, EvalContext ctx) {
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (double n : numbers(args.flatten(), ctx.getCoercion())) {
            counts.merge(n, 1, Integer::sum);
        }
        Double best = null;
        int bestCount = 1;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? FormulaError.notAvailable("No repeated value") : Value.of(best);
    }

    /** Sample variance, or its square root for STDEV. */
    private static Value variance(FunctionArgs args, EvalContext ctx, boolean root) {
        List<Double> numbers = numbers(args.flatten(), ctx.getCoercion());
        if (numbers.size() < 2) {
            return FormulaError.divZero("At least two numbers are required");
        }
        double mean = total(numbers) / numbers.size();
        double squares = 0;
        for (double n : numbers) {
            squares += (n - mean) * (n - mean);
        }
        double variance = squares / (numbers.size() - 1);
        return Value.of(root ? Math.sqrt(variance) : variance);
    }

    private static Value count(FunctionArgs args, EvalContext ctx) {
        int count = 0;
        for (Value value : args.flatten()) {
            if (ctx.getCoercion().isNumberLike(value)) {
                count++;
            }
        }
        return Value.of(count);
    }

    private static Value countA(FunctionArgs args, EvalContext ctx) {
        int count = 0;
        for (Value value : args.flatten()) {
            if (!isBlank(value)) {
                count++;
            }
        }
        return Value.of(count);
    }

    private static Value countBlank(FunctionArgs args, EvalContext ctx) {
        int count = 0;
        for (Value value : args.flatten()) {
            if (isBlank(value)) {
                count++;
            }
        }
        return Value.of(count);
    }

    // --- Conditional ---

    /**
     * SUMIF(range, criteria) or SUMIF(criteria_range, criteria, sum_range).
     */
    private static Value sumIf(FunctionArgs args, EvalContext ctx) {
        TypeCoercion coercion = ctx.getCoercion();
        List<Value> tested = coercion.flatten(Collections.singletonList(args.get(0)));
        List<Value> summed = args.has(2) ? coercion.flatten(Collections.singletonList(args.get(2))) : tested;
        if (tested.size() != summed.size()) {
            return FormulaError.value("SUMIF ranges must be the same size");
        }
        Predicate<Value> criteria = Criteria.parse(args.get(1), coercion);
        double total = 0;
        for (int i = 0; i < tested.size(); i++) {
            if (criteria.test(tested.get(i))) {
                total += coercion.toNumber(summed.get(i));
            }
        }
        return Value.of(total);
    }

    private static Value countIf(FunctionArgs args, EvalContext ctx) {
        TypeCoercion coercion = ctx.getCoercion();
        Predicate<Value> criteria = Criteria.parse(args.get(1), coercion);
        int count = 0;
        for (Value value : coercion.flatten(Collections.singletonList(args.get(0)))) {
            if (criteria.test(value)) {
                count++;
            }
        }
        return Value.of(count);
    }

    private static Value averageIf(FunctionArgs args, EvalContext ctx) {
        TypeCoercion coercion = ctx.getCoercion();
        List<Value> tested = coercion.flatten(Collections.singletonList(args.get(0)));
        List<Value> averaged = args.has(2) ? coercion.flatten(Collections.singletonList(args.get(2))) : tested;
        if (tested.size() != averaged.size()) {
            return FormulaError.value("AVERAGEIF ranges must be the same size");
        }
        Predicate<Value> criteria = Criteria.parse(args.get(1), coercion);
        double total = 0;
        int count = 0;
        for (int i = 0; i < tested.size(); i++) {
            Value value = averaged.get(i);
            if (criteria.test(tested.get(i)) && coercion.isNumberLike(value)) {
                total += coercion.toNumber(value);
                count++;
            }
        }
        return count == 0 ? FormulaError.divZero("No cells match the criteria") : Value.of(total / count);
    }

    private static Value sumProduct(FunctionArgs args, EvalContext ctx) {
        TypeCoercion coercion = ctx.getCoercion();
        List<List<Value>> arrays = new ArrayList<>();
        for (Value argument : args.asList()) {
            arrays.add(coercion.flatten(Collections.singletonList(argument)));
        }
        int length = arrays.get(0).size();
        for (List<Value> array : arrays) {
            if (array.size() != length) {
                return FormulaError.value("SUMPRODUCT arrays must be the same size");
            }
        }
        double total = 0;
        for (int i = 0; i < length; i++) {
            double product = 1;
            for (List<Value> array : arrays) {
                product *= coercion.toNumber(array.get(i));
            }
            total += product;
        }
        return Value.of(total);
    }

    // --- Rounding ---

    private static Value round(FunctionArgs args, EvalContext ctx, RoundingMode mode) {
        Value value = args.scalar(0);
        if (value.isText() && !((TextValue) value).getText().isEmpty() && !ctx.getCoercion().isNumberLike(value)) {
            return FormulaError.value("Invalid number for " + args.getFunctionName());
        }
        double number = args.number(0);
        int digits = (int) Math.max(-MAX_ROUNDING_DIGITS, Math.min(MAX_ROUNDING_DIGITS, Math.floor(args.number(1, 0))));
        BigDecimal rounded = BigDecimal.valueOf(number).setScale(digits, mode);
        return Value.of(rounded.doubleValue());
    }

    private static Value toMultiple(FunctionArgs args, boolean up) {
        double number = args.number(0);
        double significance = args.number(1, 1);
        if (significance == 0) {
            return Value.of(0);
        }
        double steps = number / significance;
        return Value.of((up ? Math.ceil(steps) : Math.floor(steps)) * significance);
    }

    // --- Arithmetic ---

    /** MOD takes the sign of the divisor: MOD(-3, 2) = 1, MOD(3, -2) = -1. */
    private static Value mod(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        double divisor = args.number(1);
        if (divisor == 0) {
            return FormulaError.divZero();
        }
        return Value.of(number - divisor * Math.floor(number / divisor));
    }

    private static Value power(FunctionArgs args, EvalContext ctx) {
        double base = args.number(0);
        double exponent = args.number(1);
        if (base == 0 && exponent < 0) {
            return FormulaError.divZero();
        }
        if (base < 0 && exponent != Math.rint(exponent)) {
            return FormulaError.num("Negative base with fractional exponent");
        }
        return Value.of(Math.pow(base, exponent));
    }

    private static Value sqrt(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        if (number < 0) {
            return FormulaError.num("SQRT of a negative number");
        }
        return Value.of(Math.sqrt(number));
    }

    private static Value ln(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        return number <= 0 ? FormulaError.num("LN needs a positive number") : Value.of(Math.log(number));
    }

    private static Value log10(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        return number <= 0 ? FormulaError.num("LOG10 needs a positive number") : Value.of(Math.log10(number));
    }

    private static Value log(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        double base = args.number(1, 10);
        if (number <= 0 || base <= 0) {
            return FormulaError.num("LOG needs positive arguments");
        }
        if (base == 1) {
            return FormulaError.divZero();
        }
        return Value.of(Math.log(number) / Math.log(base));
    }

    private static Value randBetween(FunctionArgs args, EvalContext ctx) {
        long low = (long) Math.ceil(args.number(0));
        long high = (long) Math.floor(args.number(1));
        if (low > high) {
            return FormulaError.num("RANDBETWEEN bottom is greater than top");
        }
        return Value.of(ThreadLocalRandom.current().nextLong(low, high + 1));
    }

    // --- Helpers ---

    private static FormulaFunction unary(DoubleUnaryOperator operation) {
        return (args, ctx) -> Value.of(operation.applyAsDouble(args.number(0)));
    }

    private static List<Double> numbers(List<Value> values, TypeCoercion coercion) {
        List<Double> numbers = new ArrayList<>();
        for (Value value : values) {
            if (coercion.isNumberLike(value)) {
                numbers.add(coercion.toNumber(value));
            }
        }
        return numbers;
    }

    private static double total(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    private static boolean isBlank(Value value) {
        return value.isEmpty() || (value instanceof TextValue && ((TextValue) value).getText().isEmpty());
    }
}
