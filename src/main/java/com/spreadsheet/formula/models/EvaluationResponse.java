package com.spreadsheet.formula.models;

import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaScalar;

import java.util.List;
import java.util.Map;

/**
 * Result of POST /workbook/evaluate, in request order:
 * { "cells": { "Sheet1!B2": 42, ... }, "formulas": [ 3, [[1, 2]], {"error": "#REF!"} ] }.
 */
public class EvaluationResponse {
    private final Map<String, FormulaScalar> cells;
    private final List<EvalResult> formulas;

    public EvaluationResponse(Map<String, FormulaScalar> cells, List<EvalResult> formulas) {
        this.cells = cells;
        this.formulas = formulas;
    }

    public Map<String, FormulaScalar> getCells() {
        return cells;
    }

    public List<EvalResult> getFormulas() {
        return formulas;
    }
}
