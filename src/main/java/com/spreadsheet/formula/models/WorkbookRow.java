package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A 1-based row of a sheet and the cells stored in it.
 */
public class WorkbookRow {
    private int rowNumber;
    private List<WorkbookCell> cells = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public WorkbookRow() {
    }

    public WorkbookRow(int rowNumber, List<WorkbookCell> cells) {
        this.rowNumber = rowNumber;
        this.cells = cells;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public void setRowNumber(int rowNumber) {
        this.rowNumber = rowNumber;
    }

    public List<WorkbookCell> getCells() {
        return cells;
    }

    public void setCells(List<WorkbookCell> cells) {
        this.cells = cells == null ? new ArrayList<>() : cells;
    }
}
