package com.spreadsheet.formula.values;

/**
 * Result of evaluating any part of a formula: either a single
 * {@link FormulaScalar} or a {@link FormulaArray} of nested results
 * (a range yields rows of cells, a 3-D range yields one such matrix per sheet).
 */
public abstract class EvalResult {

    EvalResult() {
    }

    public abstract boolean isArray();

    public FormulaScalar asScalar() {
        if (isArray()) {
            throw new IllegalStateException("Result is an array, not a scalar");
        }
        return (FormulaScalar) this;
    }

    public FormulaArray asArray() {
        if (!isArray()) {
            throw new IllegalStateException("Result is a scalar, not an array");
        }
        return (FormulaArray) this;
    }
}
