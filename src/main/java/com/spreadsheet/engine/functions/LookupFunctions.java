package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;

import java.util.Collections;
import java.util.List;

/**
 * Table lookups. VLOOKUP and HLOOKUP do exact matching only; a range_lookup of TRUE
 * is rejected with #VALUE!. Errors elsewhere in a lookup table do not poison the result.
 */
public final class LookupFunctions {

    private LookupFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.registerErrorAware("VLOOKUP", 3, 4, (args, ctx) -> lookup(args, ctx, true));
        registry.registerErrorAware("HLOOKUP", 3, 4, (args, ctx) -> lookup(args, ctx, false));
        registry.registerErrorAware("INDEX", 2, 3, LookupFunctions::index);
        registry.registerErrorAware("MATCH", 2, 3, LookupFunctions::match);
        registry.registerErrorAware("ROWS", 1, 1, (args, ctx) -> Value.of(table(args.get(0)).getRows()));
        registry.registerErrorAware("COLUMNS", 1, 1, (args, ctx) -> Value.of(table(args.get(0)).getColumns()));
    }

    /**
     * VLOOKUP(key, table, col_index, [range_lookup]) searches the first column;
     * HLOOKUP(key, table, row_index, [range_lookup]) searches the first row.
     */
    private static Value lookup(FunctionArgs args, EvalContext ctx, boolean vertical) {
        String name = args.getFunctionName();
        FormulaError error = firstError(args.scalar(0), args.scalar(2), args.scalar(3));
        if (error != null) {
            return error;
        }
        if (args.bool(3, false)) {
            return FormulaError.value(name + " approximate match (TRUE) is not supported");
        }
        ArrayValue table = table(args.get(1));
        double index = args.number(2);
        int limit = vertical ? table.getColumns() : table.getRows();
        if (index < 1 || index > limit) {
            return FormulaError.ref((vertical ? "Column" : "Row") + " index is out of range");
        }
        int offset = (int) Math.floor(index) - 1;
        Value key = args.scalar(0);
        int length = vertical ? table.getRows() : table.getColumns();
        for (int i = 0; i < length; i++) {
            Value candidate = vertical ? table.get(i, 0) : table.get(0, i);
            if (valuesEqual(key, candidate, ctx.getCoercion())) {
                return vertical ? table.get(i, offset) : table.get(offset, i);
            }
        }
        return FormulaError.notAvailable("Value \"" + ctx.getCoercion().toText(key) + "\" not found in lookup range");
    }

    /**
     * INDEX(array, row, [column]). Row 0 returns the whole column, column 0 the whole row.
     * On a single-row array with no column given, the second argument picks the column.
     */
    private static Value index(FunctionArgs args, EvalContext ctx) {
        FormulaError error = firstError(args.scalar(1), args.scalar(2));
        if (error != null) {
            return error;
        }
        Value source = args.get(0);
        if (source.isError()) {
            return source;
        }
        ArrayValue table = table(source);
        int row = (int) Math.floor(args.number(1));
        int column = (int) Math.floor(args.number(2, 1));
        if (!args.has(2) && table.getRows() == 1 && table.getColumns() > 1) {
            column = row;
            row = 1;
        }

        if (row == 0) {
            if (column < 1 || column > table.getColumns()) {
                return FormulaError.ref("Column index out of range");
            }
            return ArrayValue.column(table.getColumn(column - 1));
        }
        if (column == 0) {
            if (row < 1 || row > table.getRows()) {
                return FormulaError.ref("Row index out of range");
            }
            return ArrayValue.row(table.getRow(row - 1));
        }
        if (row < 1 || row > table.getRows()) {
            return FormulaError.ref("Row index out of range");
        }
        if (column < 1 || column > table.getColumns()) {
            return FormulaError.ref("Column index out of range");
        }
        return table.get(row - 1, column - 1);
    }

    /**
     * MATCH(key, array, [type]): 0 exact, 1 (default) largest value <= key in an
     * ascending array, -1 smallest value >= key in a descending array. The array is
     * not sorted here; scanning stops at the first value out of order.
     */
    private static Value match(FunctionArgs args, EvalContext ctx) {
        FormulaError error = firstError(args.scalar(0), args.scalar(2));
        if (error != null) {
            return error;
        }
        TypeCoercion coercion = ctx.getCoercion();
        Value key = args.scalar(0);
        List<Value> values = coercion.flatten(Collections.singletonList(args.get(1)));
        double type = args.number(2, 1);

        if (type == 0) {
            for (int i = 0; i < values.size(); i++) {
                if (valuesEqual(key, values.get(i), coercion)) {
                    return Value.of(i + 1);
                }
            }
            return FormulaError.notAvailable("No exact match found");
        }
        if (type != 1 && type != -1) {
            return FormulaError.value("match_type must be -1, 0, or 1");
        }
        double target = coercion.toNumber(key);
        int last = -1;
        for (int i = 0; i < values.size(); i++) {
            double candidate = coercion.toNumber(values.get(i));
            if (type == 1 ? candidate <= target : candidate >= target) {
                last = i;
            } else {
                break;
            }
        }
        return last < 0 ? FormulaError.notAvailable("No match found") : Value.of(last + 1);
    }

    /**
     * Lookup equality: same types compare directly (text case-insensitively), mixed
     * types compare as numbers when both read as numbers, otherwise as text. Blank
     * matches empty text.
     */
    static boolean valuesEqual(Value a, Value b, TypeCoercion coercion) {
        a = a.isEmpty() ? Value.of("") : a;
        b = b.isEmpty() ? Value.of("") : b;
        if (a.getType() == b.getType()) {
            if (a.isText()) {
                return coercion.toText(a).equalsIgnoreCase(coercion.toText(b));
            }
            return a.equals(b);
        }
        if (coercion.isNumberLike(a) && coercion.isNumberLike(b)) {
            return coercion.toNumber(a) == coercion.toNumber(b);
        }
        return coercion.toText(a).equalsIgnoreCase(coercion.toText(b));
    }

    private static ArrayValue table(Value value) {
        if (value instanceof ArrayValue) {
            return (ArrayValue) value;
        }
        return ArrayValue.row(Collections.singletonList(value));
    }

    private static FormulaError firstError(Value... values) {
        for (Value value : values) {
            if (value instanceof FormulaError) {
                return (FormulaError) value;
            }
        }
        return null;
    }
}
