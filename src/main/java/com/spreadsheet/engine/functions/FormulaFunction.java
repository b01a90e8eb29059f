package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.values.Value;

/**
 * A builtin spreadsheet function. Receives its evaluated arguments and the evaluation
 * context; returns a value, using a FormulaError value for anything that cannot be computed.
 */
@FunctionalInterface
public interface FormulaFunction {

    Value apply(FunctionArgs args, EvalContext context);
}
