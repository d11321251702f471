package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A table (list object): the block of cells it covers, how many of
 * those rows are header and totals rows, and its column names.
 */
public class TableDefinition {
    private String name;
    private int sheetIndex;
    private CellRange ref;
    private int headerRowCount = 1;
    private int totalsRowCount;
    private List<TableColumn> columns = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public TableDefinition() {
    }

    public TableDefinition(String name, int sheetIndex, CellRange ref,
                           int headerRowCount, int totalsRowCount, List<TableColumn> columns) {
        this.name = name;
        this.sheetIndex = sheetIndex;
        this.ref = ref;
        this.headerRowCount = headerRowCount;
        this.totalsRowCount = totalsRowCount;
        this.columns = columns;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    public CellRange getRef() {
        return ref;
    }

    public void setRef(CellRange ref) {
        this.ref = ref;
    }

    public int getHeaderRowCount() {
        return headerRowCount;
    }

    public void setHeaderRowCount(int headerRowCount) {
        this.headerRowCount = headerRowCount;
    }

    public int getTotalsRowCount() {
        return totalsRowCount;
    }

    public void setTotalsRowCount(int totalsRowCount) {
        this.totalsRowCount = totalsRowCount;
    }

    public List<TableColumn> getColumns() {
        return columns;
    }

    public void setColumns(List<TableColumn> columns) {
        this.columns = columns == null ? new ArrayList<>() : columns;
    }
}
