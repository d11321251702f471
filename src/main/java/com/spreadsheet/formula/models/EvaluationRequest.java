package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /workbook/evaluate:
 * - workbook: the snapshot to evaluate against
 * - cells: references like "Sheet1!B2" (unqualified = first sheet)
 * - formulas: ad-hoc formulas evaluated in the same workbook context
 */
public class EvaluationRequest {
    private Workbook workbook;
    private List<String> cells = new ArrayList<>();
    private List<FormulaRequest> formulas = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public EvaluationRequest() {
    }

    public EvaluationRequest(Workbook workbook, List<String> cells, List<FormulaRequest> formulas) {
        this.workbook = workbook;
        this.cells = cells;
        this.formulas = formulas;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public void setWorkbook(Workbook workbook) {
        this.workbook = workbook;
    }

    public List<String> getCells() {
        return cells;
    }

    public void setCells(List<String> cells) {
        this.cells = cells == null ? new ArrayList<>() : cells;
    }

    public List<FormulaRequest> getFormulas() {
        return formulas;
    }

    public void setFormulas(List<FormulaRequest> formulas) {
        this.formulas = formulas == null ? new ArrayList<>() : formulas;
    }
}
