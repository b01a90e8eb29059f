package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.functions.FunctionRegistry;
import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.values.Value;

import java.time.Clock;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Everything an evaluation may read: cell and range lookups, the function table,
 * the coercion rules and the clock. Passed explicitly to the evaluator and to every
 * builtin, so neither touches cell storage directly.
 */
public class EvalContext {

    private final Function<CellId, Value> cellLookup;
    private final BiFunction<CellId, CellId, List<Value>> rangeLookup;
    private final FunctionRegistry functions;
    private final TypeCoercion coercion;
    private final Clock clock;

    /**
     * @param cellLookup  value of one cell; blank cells yield EmptyValue
     * @param rangeLookup values of the rectangle between two corners, row-major
     */
    public EvalContext(Function<CellId, Value> cellLookup,
                       BiFunction<CellId, CellId, List<Value>> rangeLookup,
                       FunctionRegistry functions,
                       TypeCoercion coercion,
                       Clock clock) {
        this.cellLookup = cellLookup;
        this.rangeLookup = rangeLookup;
        this.functions = functions;
        this.coercion = coercion;
        this.clock = clock;
    }

    public Value getCellValue(CellId cell) {
        return cellLookup.apply(cell);
    }

    public List<Value> getRangeValues(CellId start, CellId end) {
        return rangeLookup.apply(start, end);
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    public TypeCoercion getCoercion() {
        return coercion;
    }

    public Clock getClock() {
        return clock;
    }
}
