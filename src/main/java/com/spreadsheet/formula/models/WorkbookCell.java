package com.spreadsheet.formula.models;

/**
 * One stored cell of a sheet: its address plus either a literal
 * value or a formula (the value then holds the last cached result).
 */
public class WorkbookCell {
    private CellAddress address;
    private CellValue value = CellValue.empty();
    private Formula formula;

    // Default constructor needed for JSON (de)serialization
    public WorkbookCell() {
    }

    public WorkbookCell(CellAddress address, CellValue value) {
        this.address = address;
        this.value = value;
    }

    public WorkbookCell(CellAddress address, Formula formula) {
        this.address = address;
        this.formula = formula;
    }

    public CellAddress getAddress() {
        return address;
    }

    public void setAddress(CellAddress address) {
        this.address = address;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value == null ? CellValue.empty() : value;
    }

    public Formula getFormula() {
        return formula;
    }

    public void setFormula(Formula formula) {
        this.formula = formula;
    }

    public boolean hasFormula() {
        return formula != null && formula.getExpression() != null && !formula.getExpression().trim().isEmpty();
    }
}
