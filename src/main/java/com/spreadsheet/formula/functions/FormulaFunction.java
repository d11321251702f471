package com.spreadsheet.formula.functions;

/**
 * A function callable from formulas. Implement
 * {@link EagerFormulaFunction} or {@link LazyFormulaFunction}.
 */
public interface FormulaFunction {

    /**
     * Name as written in formulas, e.g. "SUM". Lookup is case-insensitive.
     */
    String getName();

    default FunctionNamespace getNamespace() {
        return FunctionNamespace.STANDARD;
    }

    /**
     * Grouping label such as "aggregate" or "logical", or null.
     */
    default String getCategory() {
        return null;
    }
}
