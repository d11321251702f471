package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;

/**
 * Callbacks the node evaluator uses to reach workbook data.
 * Implementations cache cell values and guard against cycles.
 */
public interface WorkbookResolver {

    /**
     * @return the index of the named sheet, or null if there is none
     */
    Integer resolveSheetIndex(String sheetName);

    /**
     * The value of one cell. Error values are raised as FormulaErrorException.
     */
    FormulaScalar resolveCell(int sheetIndex, CellAddress address);

    /**
     * Rows of cell values for a block on one sheet. The range's own sheet
     * qualifier is ignored; open-ended rows/columns are clamped to the
     * sheet's bounds. Raises the first error value it meets.
     */
    FormulaArray resolveRange(int sheetIndex, CellRange range);

    EvalResult resolveName(String name, EvaluationScope scope);

    EvalResult resolveStructuredReference(StructuredReferenceNode node, EvaluationScope scope);
}
