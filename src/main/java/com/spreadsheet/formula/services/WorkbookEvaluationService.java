package com.spreadsheet.formula.services;

import com.spreadsheet.formula.evaluation.FormulaEvaluator;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.EvaluationRequest;
import com.spreadsheet.formula.models.EvaluationResponse;
import com.spreadsheet.formula.models.FormulaRequest;
import com.spreadsheet.formula.models.SheetCellReference;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaScalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates batches of cells and formulas against workbook snapshots.
 * Every request gets its own evaluator, shared by the whole batch.
 */
@Service
public class WorkbookEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(WorkbookEvaluationService.class);

    private final FormulaParser parser;
    private final FunctionRegistry registry;
    private final FunctionHelpers helpers;

    public WorkbookEvaluationService(FormulaParser parser, FunctionRegistry registry, FunctionHelpers helpers) {
        this.parser = parser;
        this.registry = registry;
        this.helpers = helpers;
    }

    /**
     * A fresh evaluator bound to the snapshot; its caches live as long as it does.
     */
    public FormulaEvaluator createEvaluator(Workbook workbook) {
        return new FormulaEvaluator(workbook, parser, registry, helpers);
    }

    /**
     * Evaluates a request with these steps:
     * 1) Build one evaluator for the snapshot.
     * 2) Evaluate each requested cell ("Sheet1!B2", unqualified = first sheet).
     * 3) Evaluate each ad-hoc formula at its origin (A1 by default).
     * Unknown sheet names in the request raise SheetNotFoundException.
     */
    public EvaluationResponse evaluate(EvaluationRequest request) {
        Workbook workbook = request.getWorkbook() == null ? new Workbook() : request.getWorkbook();

        // 1) One evaluator for the batch
        FormulaEvaluator evaluator = createEvaluator(workbook);
        String firstSheetName = workbook.getSheets().isEmpty() ? null : workbook.getSheets().get(0).getName();

        // 2) Cells
        Map<String, FormulaScalar> cells = new LinkedHashMap<>();
        for (String reference : request.getCells()) {
            SheetCellReference cell = SheetCellReference.parse(reference, firstSheetName);
            int sheetIndex = requireSheetIndex(evaluator, cell.getSheetName());
            cells.put(reference, evaluator.evaluateCell(sheetIndex, cell.getAddress()));
        }

        // 3) Formulas
        List<EvalResult> formulas = new ArrayList<>();
        for (FormulaRequest formula : request.getFormulas()) {
            String sheetName = formula.getSheet() != null ? formula.getSheet() : firstSheetName;
            int sheetIndex = requireSheetIndex(evaluator, sheetName);
            CellAddress origin = formula.getOrigin() != null ? formula.getOrigin() : new CellAddress(1, 1);
            formulas.add(evaluator.evaluateFormulaResult(sheetIndex, origin, formula.getFormula()));
        }

        log.debug("Evaluated {} cell(s) and {} formula(s) over {} sheet(s)",
                cells.size(), formulas.size(), workbook.getSheets().size());
        return new EvaluationResponse(cells, formulas);
    }

    private int requireSheetIndex(FormulaEvaluator evaluator, String sheetName) {
        Integer index = sheetName == null ? null : evaluator.findSheetIndex(sheetName);
        if (index == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetName);
        }
        return index;
    }
}
