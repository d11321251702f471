package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.FormulaType;
import com.spreadsheet.formula.models.SheetCellReference;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.models.WorkbookCell;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates cells and ad-hoc formulas against one workbook snapshot.
 *
 * Parsed formulas and computed cell values are cached for the lifetime of
 * the instance and never invalidated: a changed workbook needs a new
 * evaluator. A cell that is re-entered while it is still being computed
 * evaluates to #REF!.
 *
 * Not thread-safe; use one instance per thread.
 */
public class FormulaEvaluator {
    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final CellAddress TOP_LEFT = new CellAddress(1, 1);

    private final WorkbookMatrix matrix;
    private final FormulaParser parser;
    private final FunctionHelpers helpers;
    private final NodeEvaluator nodeEvaluator;
    private final DefinedNameResolver nameResolver;
    private final StructuredReferenceResolver tableResolver;
    private final WorkbookResolver resolver = new CachingWorkbookResolver();

    // A null value marks formula text that failed to parse
    private final Map<String, FormulaNode> astCache = new HashMap<>();
    private final Map<String, FormulaScalar> valueCache = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    public FormulaEvaluator(Workbook workbook, FormulaParser parser, FunctionRegistry registry, FunctionHelpers helpers) {
        this.matrix = WorkbookMatrix.build(workbook);
        this.parser = parser;
        this.helpers = helpers;
        this.nodeEvaluator = new NodeEvaluator(registry, helpers, workbook.getDateSystem());
        this.nameResolver = new DefinedNameResolver(workbook.getDefinedNames(), nodeEvaluator, this);
        this.tableResolver = new StructuredReferenceResolver(workbook.getTables());
    }

    /**
     * The value of one cell, computed at most once per evaluator.
     * Cells with nothing stored are blank.
     */
    public FormulaScalar evaluateCell(int sheetIndex, CellAddress address) {
        return resolveCellScalar(sheetIndex, address);
    }

    /**
     * Evaluates formula text as if it were entered in A1 of the given sheet,
     * reduced to a single value.
     */
    public FormulaScalar evaluateFormula(int sheetIndex, String formula) {
        return evaluateFormulaScalar(sheetIndex, TOP_LEFT, formula);
    }

    /**
     * Evaluates formula text at an arbitrary origin and returns the raw
     * result, which may be an array. Spreadsheet errors come back as error
     * scalars; a formula that does not parse is #NAME?.
     */
    public EvalResult evaluateFormulaResult(int sheetIndex, CellAddress origin, String formula) {
        String normalized = normalizeFormulaText(formula);
        FormulaNode ast = getOrParseAst(sheetIndex + "|" + normalized, normalized);
        if (ast == null) {
            return FormulaScalar.error(ErrorCode.NAME);
        }

        SheetMatrix sheet = matrix.getSheet(sheetIndex);
        if (sheet == null) {
            return FormulaScalar.error(ErrorCode.REF);
        }

        EvaluationScope scope = new EvaluationScope(resolver, sheetIndex,
                new SheetCellReference(sheet.getSheetName(), origin));
        try {
            return nodeEvaluator.evaluate(ast, scope);
        } catch (FormulaErrorException e) {
            return FormulaScalar.error(e.getCode());
        }
    }

    /**
     * @return the index of the named sheet (trimmed, case-insensitive), or null
     */
    public Integer findSheetIndex(String sheetName) {
        return matrix.resolveSheetIndex(sheetName);
    }

    public int getSheetCount() {
        return matrix.getSheetCount();
    }

    /**
     * Trims the text and strips one leading "=".
     */
    static String normalizeFormulaText(String formula) {
        String trimmed = formula == null ? "" : formula.trim();
        if (trimmed.startsWith("=")) {
            return trimmed.substring(1).trim();
        }
        return trimmed;
    }

    private FormulaNode getOrParseAst(String cacheKey, String formula) {
        if (astCache.containsKey(cacheKey)) {
            return astCache.get(cacheKey);
        }
        FormulaNode parsed;
        try {
            parsed = parser.parse(formula);
        } catch (FormulaParseException e) {
            log.debug("Formula \"{}\" does not parse, evaluating to #NAME?: {}", formula, e.getMessage());
            parsed = null;
        }
        astCache.put(cacheKey, parsed);
        return parsed;
    }

    private FormulaScalar evaluateFormulaScalar(int sheetIndex, CellAddress origin, String formula) {
        EvalResult evaluated = evaluateFormulaResult(sheetIndex, origin, formula);
        if (!evaluated.isArray()) {
            return evaluated.asScalar();
        }
        try {
            return helpers.coerceScalar(evaluated, "formula");
        } catch (FormulaErrorException e) {
            return FormulaScalar.error(e.getCode());
        }
    }

    /**
     * 1) cached value
     * 2) #REF! when the cell is already being computed (not cached)
     * 3) compute, cache, release the in-progress marker
     */
    private FormulaScalar resolveCellScalar(int sheetIndex, CellAddress address) {
        String key = sheetIndex + "|" + address.getColumn() + ":" + address.getRow();

        // 1) Cache
        FormulaScalar cached = valueCache.get(key);
        if (cached != null) {
            return cached;
        }

        // 2) Cycle guard
        if (inProgress.contains(key)) {
            log.trace("Circular reference through sheet {} cell {}", sheetIndex, address);
            return FormulaScalar.error(ErrorCode.REF);
        }

        // 3) Compute
        inProgress.add(key);
        try {
            FormulaScalar result = computeCellScalar(sheetIndex, address);
            valueCache.put(key, result);
            return result;
        } finally {
            inProgress.remove(key);
        }
    }

    private FormulaScalar computeCellScalar(int sheetIndex, CellAddress address) {
        SheetMatrix sheet = matrix.getSheet(sheetIndex);
        if (sheet == null) {
            return FormulaScalar.blank();
        }
        WorkbookCell cell = sheet.getCell(address.getColumn(), address.getRow());

        if (cell != null && cell.hasFormula()) {
            String expression = cell.getFormula().getExpression();
            if (cell.getFormula().getType() == FormulaType.ARRAY && cell.getFormula().getRef() != null) {
                return evaluateArrayFormulaCell(sheetIndex, address, expression, cell.getFormula().getRef());
            }
            return evaluateFormulaScalar(sheetIndex, address, expression);
        }

        if (cell == null) {
            return FormulaScalar.blank();
        }
        return toScalar(cell.getValue());
    }

    /**
     * The element of an array formula's result owed to the cell that
     * carries the formula, by its offset within the spill range. The
     * formula is evaluated at the range's top-left corner; a bare scalar
     * result counts as a 1x1 matrix.
     */
    private FormulaScalar evaluateArrayFormulaCell(int sheetIndex, CellAddress address, String expression, CellRange ref) {
        int rowOffset = address.getRow() - ref.getMinRow();
        int columnOffset = address.getColumn() - ref.getMinColumn();
        if (rowOffset < 0 || columnOffset < 0
                || rowOffset > ref.getMaxRow() - ref.getMinRow()
                || columnOffset > ref.getMaxColumn() - ref.getMinColumn()) {
            return FormulaScalar.error(ErrorCode.REF);
        }

        EvalResult evaluated = evaluateFormulaResult(sheetIndex, ref.getTopLeft(), expression);
        List<List<FormulaScalar>> values = helpers.toScalarMatrix(evaluated);
        if (rowOffset >= values.size() || columnOffset >= values.get(rowOffset).size()) {
            return FormulaScalar.error(ErrorCode.VALUE);
        }
        return values.get(rowOffset).get(columnOffset);
    }

    private static FormulaScalar toScalar(CellValue value) {
        switch (value.getType()) {
            case STRING:
                return FormulaScalar.text((String) value.getValue());
            case NUMBER:
                return FormulaScalar.number((Double) value.getValue());
            case BOOLEAN:
                return FormulaScalar.bool((Boolean) value.getValue());
            case ERROR:
                return FormulaScalar.error((ErrorCode) value.getValue());
            case DATE:
                return FormulaScalar.text(ISO_MILLIS.format((Instant) value.getValue()));
            case EMPTY:
            default:
                return FormulaScalar.blank();
        }
    }

    /**
     * Workbook access for the node evaluator, backed by this evaluator's caches.
     */
    private class CachingWorkbookResolver implements WorkbookResolver {

        @Override
        public Integer resolveSheetIndex(String sheetName) {
            return matrix.resolveSheetIndex(sheetName);
        }

        @Override
        public FormulaScalar resolveCell(int sheetIndex, CellAddress address) {
            FormulaScalar value = resolveCellScalar(sheetIndex, address);
            if (value.isError()) {
                throw new FormulaErrorException(value.getErrorCode());
            }
            return value;
        }

        @Override
        public FormulaArray resolveRange(int sheetIndex, CellRange range) {
            SheetMatrix sheet = matrix.getSheet(sheetIndex);
            int sheetMaxRow = sheet == null ? CellAddress.MAX_ROWS : sheet.getMaxRow();
            int sheetMaxColumn = sheet == null ? CellAddress.MAX_COLUMNS : sheet.getMaxColumn();

            // Whole-column / whole-row ends stop at the sheet's used area
            int maxRow = range.getMaxRow() == CellAddress.MAX_ROWS ? sheetMaxRow : range.getMaxRow();
            int maxColumn = range.getMaxColumn() == CellAddress.MAX_COLUMNS ? sheetMaxColumn : range.getMaxColumn();

            List<List<FormulaScalar>> rows = new ArrayList<>();
            for (int row = range.getMinRow(); row <= maxRow; row++) {
                List<FormulaScalar> values = new ArrayList<>();
                for (int column = range.getMinColumn(); column <= maxColumn; column++) {
                    values.add(resolveCell(sheetIndex, new CellAddress(column, row)));
                }
                rows.add(values);
            }
            return FormulaArray.ofRows(rows);
        }

        @Override
        public EvalResult resolveName(String name, EvaluationScope scope) {
            return nameResolver.resolve(name, scope);
        }

        @Override
        public EvalResult resolveStructuredReference(StructuredReferenceNode node, EvaluationScope scope) {
            return tableResolver.resolve(node, scope);
        }
    }
}
