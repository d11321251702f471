package com.spreadsheet.formula.values;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of results. A matrix is an array of row arrays;
 * a 3-D range is an array of matrices, one per sheet.
 */
public final class FormulaArray extends EvalResult {

    private final List<EvalResult> elements;

    private FormulaArray(List<EvalResult> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    public static FormulaArray of(List<? extends EvalResult> elements) {
        return new FormulaArray(new ArrayList<>(elements));
    }

    /**
     * Builds a matrix (array of row arrays) from rows of scalars.
     */
    public static FormulaArray ofRows(List<? extends List<? extends EvalResult>> rows) {
        List<EvalResult> rowArrays = new ArrayList<>(rows.size());
        for (List<? extends EvalResult> row : rows) {
            rowArrays.add(of(row));
        }
        return new FormulaArray(rowArrays);
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @JsonValue
    public List<EvalResult> getElements() {
        return elements;
    }

    public EvalResult get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaArray)) {
            return false;
        }
        return elements.equals(((FormulaArray) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
