package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.values.EvalResult;

import java.util.List;

/**
 * A function that receives its arguments unevaluated and decides
 * which of them to evaluate (IF, IFERROR, CHOOSE...).
 */
public interface LazyFormulaFunction extends FormulaFunction {

    EvalResult evaluate(List<FormulaNode> arguments, LazyEvaluationContext context);
}
