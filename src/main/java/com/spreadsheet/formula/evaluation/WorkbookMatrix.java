package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.models.WorkbookCell;
import com.spreadsheet.formula.models.WorkbookRow;
import com.spreadsheet.formula.models.WorkbookSheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The workbook's sheets indexed for cell lookup, built once per snapshot
 * and never modified afterwards.
 */
public final class WorkbookMatrix {
    private final List<SheetMatrix> sheets;
    private final Map<String, Integer> sheetIndexByName;

    private WorkbookMatrix(List<SheetMatrix> sheets, Map<String, Integer> sheetIndexByName) {
        this.sheets = Collections.unmodifiableList(sheets);
        this.sheetIndexByName = Collections.unmodifiableMap(sheetIndexByName);
    }

    /**
     * Indexes every sheet of the workbook:
     * 1) bounds start at the declared dimension (at least 1x1)
     * 2) any stored cell outside the dimension grows the bounds
     * 3) sheet names are matched trimmed and case-insensitively; a later
     *    sheet with a colliding name replaces the earlier one in the lookup
     */
    public static WorkbookMatrix build(Workbook workbook) {
        List<SheetMatrix> sheets = new ArrayList<>();
        Map<String, Integer> sheetIndexByName = new HashMap<>();

        for (int index = 0; index < workbook.getSheets().size(); index++) {
            WorkbookSheet sheet = workbook.getSheets().get(index);
            String name = sheet.getName() == null ? "" : sheet.getName();
            sheetIndexByName.put(normalizeSheetName(name), index);

            // 1) Seed the bounds
            int maxRow = 1;
            int maxColumn = 1;
            CellRange dimension = sheet.getDimension();
            if (dimension != null) {
                maxRow = Math.max(maxRow, dimension.getMaxRow());
                maxColumn = Math.max(maxColumn, dimension.getMaxColumn());
            }

            // 2) Index the cells
            Map<Integer, Map<Integer, WorkbookCell>> rows = new HashMap<>();
            // The cell's own address decides where it lands
            for (WorkbookRow row : sheet.getRows()) {
                maxRow = Math.max(maxRow, row.getRowNumber());
                for (WorkbookCell cell : row.getCells()) {
                    if (cell.getAddress() == null) {
                        continue;
                    }
                    int rowNumber = cell.getAddress().getRow();
                    maxRow = Math.max(maxRow, rowNumber);
                    maxColumn = Math.max(maxColumn, cell.getAddress().getColumn());
                    rows.computeIfAbsent(rowNumber, r -> new HashMap<>()).put(cell.getAddress().getColumn(), cell);
                }
            }
            sheets.add(new SheetMatrix(name, rows, maxRow, maxColumn));
        }
        return new WorkbookMatrix(sheets, sheetIndexByName);
    }

    public static String normalizeSheetName(String sheetName) {
        return sheetName.trim().toUpperCase(Locale.ROOT);
    }

    public int getSheetCount() {
        return sheets.size();
    }

    /**
     * @return the sheet at the index, or null when the index is out of range
     */
    public SheetMatrix getSheet(int sheetIndex) {
        if (sheetIndex < 0 || sheetIndex >= sheets.size()) {
            return null;
        }
        return sheets.get(sheetIndex);
    }

    /**
     * @return the sheet's index, or null for an unknown name
     */
    public Integer resolveSheetIndex(String sheetName) {
        if (sheetName == null) {
            return null;
        }
        return sheetIndexByName.get(normalizeSheetName(sheetName));
    }
}
