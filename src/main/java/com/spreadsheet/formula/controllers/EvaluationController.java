package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.EvaluationRequest;
import com.spreadsheet.formula.models.EvaluationResponse;
import com.spreadsheet.formula.services.WorkbookEvaluationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoint for evaluating workbook snapshots.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class EvaluationController {

    @Autowired
    private WorkbookEvaluationService evaluationService;

    /**
     * POST /workbook/evaluate
     * Body: { "workbook": {...}, "cells": ["Sheet1!B2"], "formulas": [{"sheet", "origin", "formula"}] }.
     * Returns evaluated cells keyed by the requested reference and the formula
     * results in request order. Spreadsheet errors are values ({"error": "#REF!"}),
     * not HTTP failures.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@RequestBody EvaluationRequest request) {
        return ResponseEntity.ok(evaluationService.evaluate(request));
    }
}
