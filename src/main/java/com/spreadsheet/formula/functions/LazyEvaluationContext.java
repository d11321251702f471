package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.models.DateSystem;
import com.spreadsheet.formula.models.SheetCellReference;
import com.spreadsheet.formula.values.EvalResult;

import java.util.function.Function;

/**
 * What a lazy function can do with its argument nodes: evaluate them
 * in the caller's scope, coerce results, and resolve reference text
 * relative to the formula's origin.
 */
public class LazyEvaluationContext {
    private final Function<FormulaNode, EvalResult> evaluator;
    private final FunctionHelpers helpers;
    private final SheetCellReference origin;
    private final DateSystem dateSystem;

    public LazyEvaluationContext(Function<FormulaNode, EvalResult> evaluator, FunctionHelpers helpers,
                                 SheetCellReference origin, DateSystem dateSystem) {
        this.evaluator = evaluator;
        this.helpers = helpers;
        this.origin = origin;
        this.dateSystem = dateSystem;
    }

    /**
     * Evaluates one argument node. Spreadsheet errors surface as
     * FormulaErrorException, so a function like IFERROR catches that.
     */
    public EvalResult evaluate(FormulaNode node) {
        return evaluator.apply(node);
    }

    public FunctionHelpers getHelpers() {
        return helpers;
    }

    /**
     * Parses "Sheet2!B4" or "B4"; unqualified text is placed on the origin's sheet.
     */
    public SheetCellReference parseReference(String reference) {
        return SheetCellReference.parse(reference, origin.getSheetName());
    }

    public SheetCellReference getOrigin() {
        return origin;
    }

    public DateSystem getDateSystem() {
        return dateSystem;
    }
}
