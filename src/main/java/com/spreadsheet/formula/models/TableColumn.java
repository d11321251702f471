package com.spreadsheet.formula.models;

/**
 * A named column of a table, in declaration (left-to-right) order.
 */
public class TableColumn {
    private String name;

    // Default constructor needed for JSON (de)serialization
    public TableColumn() {
    }

    public TableColumn(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
