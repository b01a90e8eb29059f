package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.Value;

/**
 * IS* predicates, TYPE and NA. All of them see errors as ordinary arguments.
 */
public final class InfoFunctions {

    private InfoFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.registerErrorAware("ISBLANK", 1, 1, (args, ctx) -> Value.of(isBlank(args.scalar(0))));
        registry.registerErrorAware("ISERROR", 1, 1, (args, ctx) -> Value.of(LogicalFunctions.isError(args.scalar(0))));
        registry.registerErrorAware("ISNA", 1, 1, (args, ctx) -> Value.of(LogicalFunctions.isNotAvailable(args.scalar(0))));
        registry.registerErrorAware("ISNUMBER", 1, 1, (args, ctx) -> Value.of(args.scalar(0).isNumber()));
        registry.registerErrorAware("ISTEXT", 1, 1, (args, ctx) -> Value.of(args.scalar(0).isText()));
        registry.registerErrorAware("ISLOGICAL", 1, 1, (args, ctx) -> Value.of(args.scalar(0).isBoolean()));
        registry.registerErrorAware("ISEVEN", 1, 1, (args, ctx) -> parity(args, true));
        registry.registerErrorAware("ISODD", 1, 1, (args, ctx) -> parity(args, false));
        registry.registerErrorAware("TYPE", 1, 1, InfoFunctions::type);
        registry.register("NA", 0, 0, (args, ctx) -> FormulaError.notAvailable("Value not available"));
    }

    private static boolean isBlank(Value value) {
        return value.isEmpty() || (value instanceof TextValue && ((TextValue) value).getText().isEmpty());
    }

    /** ISEVEN / ISODD truncate toward zero; an error argument is returned as is. */
    private static Value parity(FunctionArgs args, boolean even) {
        Value value = args.scalar(0);
        if (value.isError()) {
            return value;
        }
        long number = (long) args.number(0);
        return Value.of((number % 2 == 0) == even);
    }

    /** TYPE: 1 number (and blank), 2 text, 4 logical, 16 error, 64 array. */
    private static Value type(FunctionArgs args, EvalContext ctx) {
        switch (args.get(0).getType()) {
            case TEXT:
                return Value.of(2);
            case BOOLEAN:
                return Value.of(4);
            case ERROR:
                return Value.of(16);
            case ARRAY:
                return Value.of(64);
            default:
                return Value.of(1);
        }
    }
}
