package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.values.EvalResult;

import java.util.List;

/**
 * A function whose arguments are all evaluated, left to right,
 * before it is called. Range arguments arrive as nested arrays.
 */
public interface EagerFormulaFunction extends FormulaFunction {

    EvalResult evaluate(List<EvalResult> arguments, FunctionHelpers helpers);
}
