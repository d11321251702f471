package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.models.WorkbookCell;

import java.util.Collections;
import java.util.Map;

/**
 * Indexed, read-only view of one sheet: row number -> column number -> cell,
 * plus the bounds that open-ended ranges (A:A, 1:1) are clamped to.
 */
public final class SheetMatrix {
    private final String sheetName;
    private final Map<Integer, Map<Integer, WorkbookCell>> rows;
    private final int maxRow;
    private final int maxColumn;

    SheetMatrix(String sheetName, Map<Integer, Map<Integer, WorkbookCell>> rows, int maxRow, int maxColumn) {
        this.sheetName = sheetName;
        this.rows = Collections.unmodifiableMap(rows);
        this.maxRow = maxRow;
        this.maxColumn = maxColumn;
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxColumn() {
        return maxColumn;
    }

    /**
     * @return the stored cell, or null when nothing is stored there
     */
    public WorkbookCell getCell(int column, int row) {
        Map<Integer, WorkbookCell> rowCells = rows.get(row);
        return rowCells == null ? null : rowCells.get(column);
    }
}
