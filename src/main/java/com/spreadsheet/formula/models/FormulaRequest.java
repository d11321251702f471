package com.spreadsheet.formula.models;

/**
 * An ad-hoc formula to evaluate: the sheet it runs on (by name; the first
 * sheet when omitted), an optional origin cell (A1 when omitted)
 * and the formula text.
 */
public class FormulaRequest {
    private String sheet;
    private CellAddress origin;
    private String formula;

    // Default constructor needed for JSON (de)serialization
    public FormulaRequest() {
    }

    public FormulaRequest(String sheet, CellAddress origin, String formula) {
        this.sheet = sheet;
        this.origin = origin;
        this.formula = formula;
    }

    public String getSheet() {
        return sheet;
    }

    public void setSheet(String sheet) {
        this.sheet = sheet;
    }

    public CellAddress getOrigin() {
        return origin;
    }

    public void setOrigin(CellAddress origin) {
        this.origin = origin;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }
}
