package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A worksheet in the snapshot: its name, the declared used range
 * (if the source file recorded one) and its rows.
 */
public class WorkbookSheet {
    private String name;
    private CellRange dimension;
    private List<WorkbookRow> rows = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public WorkbookSheet() {
    }

    public WorkbookSheet(String name, CellRange dimension, List<WorkbookRow> rows) {
        this.name = name;
        this.dimension = dimension;
        this.rows = rows;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public CellRange getDimension() {
        return dimension;
    }

    public void setDimension(CellRange dimension) {
        this.dimension = dimension;
    }

    public List<WorkbookRow> getRows() {
        return rows;
    }

    public void setRows(List<WorkbookRow> rows) {
        this.rows = rows == null ? new ArrayList<>() : rows;
    }
}
