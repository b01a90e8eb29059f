package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.EmptyValue;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;

import java.util.Collections;
import java.util.List;

/**
 * Evaluated arguments of one function call. Range arguments arrive as
 * {@link ArrayValue}s; {@link #flatten()} turns them into one scalar list.
 */
public class FunctionArgs {

    private final String functionName;
    private final List<Value> values;
    private final TypeCoercion coercion;

    public FunctionArgs(String functionName, List<Value> values, TypeCoercion coercion) {
        this.functionName = functionName;
        this.values = Collections.unmodifiableList(values);
        this.coercion = coercion;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int size() {
        return values.size();
    }

    public boolean has(int index) {
        return index < values.size();
    }

    /** The argument as given, or EmptyValue when it was omitted. */
    public Value get(int index) {
        return has(index) ? values.get(index) : EmptyValue.INSTANCE;
    }

    /** The argument with arrays reduced to their first element. */
    public Value scalar(int index) {
        return coercion.scalar(get(index));
    }

    public List<Value> asList() {
        return values;
    }

    /** All arguments with arrays expanded, in order. */
    public List<Value> flatten() {
        return coercion.flatten(values);
    }

    public double number(int index) {
        return coercion.toNumber(get(index));
    }

    public double number(int index, double defaultValue) {
        return has(index) && !get(index).isEmpty() ? number(index) : defaultValue;
    }

    public String text(int index) {
        return coercion.toText(get(index));
    }

    public boolean bool(int index) {
        return coercion.toBoolean(get(index));
    }

    public boolean bool(int index, boolean defaultValue) {
        return has(index) && !get(index).isEmpty() ? bool(index) : defaultValue;
    }

    /**
     * The first error among the arguments, looking inside arrays, or null.
     */
    public FormulaError firstError() {
        for (Value value : values) {
            if (value instanceof FormulaError) {
                return (FormulaError) value;
            }
            if (value instanceof ArrayValue) {
                for (Value element : ((ArrayValue) value).getValues()) {
                    if (element instanceof FormulaError) {
                        return (FormulaError) element;
                    }
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return functionName + values;
    }
}
