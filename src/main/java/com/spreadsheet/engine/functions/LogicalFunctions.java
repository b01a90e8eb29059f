package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.ErrorType;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.Value;

import static com.spreadsheet.engine.functions.FunctionRegistry.VARIADIC;

/**
 * IF family, boolean connectives and error fallbacks.
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.registerErrorAware("IF", 2, 3, LogicalFunctions::ifFunction);
        registry.registerErrorAware("IFS", 2, VARIADIC, LogicalFunctions::ifs);
        registry.registerErrorAware("IFERROR", 2, 2, (args, ctx) -> isError(args.scalar(0)) ? args.get(1) : args.get(0));
        registry.registerErrorAware("IFNA", 2, 2, (args, ctx) -> isNotAvailable(args.scalar(0)) ? args.get(1) : args.get(0));
        registry.registerErrorAware("SWITCH", 3, VARIADIC, LogicalFunctions::switchFunction);
        registry.registerErrorAware("CHOOSE", 2, VARIADIC, LogicalFunctions::choose);
        registry.register("AND", 0, VARIADIC, (args, ctx) -> connective(args, ctx, true));
        registry.register("OR", 0, VARIADIC, (args, ctx) -> connective(args, ctx, false));
        registry.register("XOR", 1, VARIADIC, LogicalFunctions::xor);
        registry.register("NOT", 1, 1, (args, ctx) -> Value.of(!args.bool(0)));
    }

    /**
     * IF(test, value_if_true, [value_if_false]); a missing value_if_false yields FALSE.
     */
    private static Value ifFunction(FunctionArgs args, EvalContext ctx) {
        Value test = args.scalar(0);
        if (test.isError()) {
            return test;
        }
        if (args.bool(0)) {
            return args.get(1);
        }
        return args.has(2) ? args.get(2) : Value.of(false);
    }

    /**
     * IFS(test1, value1, test2, value2, ...): the value of the first true test.
     */
    private static Value ifs(FunctionArgs args, EvalContext ctx) {
        if (args.size() % 2 != 0) {
            return FormulaError.value("IFS needs condition/value pairs");
        }
        for (int i = 0; i < args.size(); i += 2) {
            Value test = args.scalar(i);
            if (test.isError()) {
                return test;
            }
            if (args.bool(i)) {
                return args.get(i + 1);
            }
        }
        return FormulaError.notAvailable("No IFS condition was true");
    }

    /**
     * SWITCH(expression, case1, result1, ..., [default]).
     */
    private static Value switchFunction(FunctionArgs args, EvalContext ctx) {
        Value expression = args.scalar(0);
        if (expression.isError()) {
            return expression;
        }
        TypeCoercion coercion = ctx.getCoercion();
        int i = 1;
        for (; i + 1 < args.size(); i += 2) {
            if (LookupFunctions.valuesEqual(expression, args.scalar(i), coercion)) {
                return args.get(i + 1);
            }
        }
        if (i < args.size()) {
            return args.get(i); // default
        }
        return FormulaError.notAvailable("No SWITCH case matched");
    }

    /**
     * CHOOSE(index, value1, value2, ...), 1-based.
     */
    private static Value choose(FunctionArgs args, EvalContext ctx) {
        Value index = args.scalar(0);
        if (index.isError()) {
            return index;
        }
        int position = (int) Math.floor(args.number(0));
        if (position < 1 || position >= args.size()) {
            return FormulaError.value("CHOOSE index out of range");
        }
        return args.get(position);
    }

    private static Value connective(FunctionArgs args, EvalContext ctx, boolean and) {
        for (Value value : args.flatten()) {
            if (!isLogical(value, ctx.getCoercion())) {
                continue;
            }
            boolean truth = truth(value, ctx.getCoercion());
            if (and && !truth) {
                return Value.of(false);
            }
            if (!and && truth) {
                return Value.of(true);
            }
        }
        return Value.of(and);
    }

    private static Value xor(FunctionArgs args, EvalContext ctx) {
        int trueCount = 0;
        for (Value value : args.flatten()) {
            if (isLogical(value, ctx.getCoercion()) && truth(value, ctx.getCoercion())) {
                trueCount++;
            }
        }
        return Value.of(trueCount % 2 == 1);
    }

    /** Blanks and plain text do not take part in AND / OR / XOR. */
    private static boolean isLogical(Value value, TypeCoercion coercion) {
        if (value.isEmpty()) {
            return false;
        }
        if (value instanceof TextValue) {
            String text = ((TextValue) value).getText();
            return text.equalsIgnoreCase("TRUE") || text.equalsIgnoreCase("FALSE") || coercion.isNumeric(text);
        }
        return true;
    }

    private static boolean truth(Value value, TypeCoercion coercion) {
        if (value instanceof TextValue) {
            String text = ((TextValue) value).getText();
            return coercion.isNumeric(text) ? coercion.toNumber(value) != 0 : text.equalsIgnoreCase("TRUE");
        }
        return coercion.toBoolean(value);
    }

    /**
     * True for error values and for text spelling an error code, e.g. "#N/A".
     */
    static boolean isError(Value value) {
        if (value instanceof FormulaError) {
            return true;
        }
        return value instanceof TextValue && ErrorType.fromCode(((TextValue) value).getText()) != null;
    }

    static boolean isNotAvailable(Value value) {
        if (value instanceof FormulaError) {
            return ((FormulaError) value).getErrorType() == ErrorType.NOT_AVAILABLE;
        }
        return value instanceof TextValue && ErrorType.fromCode(((TextValue) value).getText()) == ErrorType.NOT_AVAILABLE;
    }
}
