package com.spreadsheet.formula.models;

/**
 * A formula definition attached to a cell: the expression text
 * (with or without the leading "="), the kind, and for array
 * formulas the range the result spills over.
 */
public class Formula {
    private String expression;
    private FormulaType type = FormulaType.NORMAL;
    private CellRange ref;

    // Default constructor needed for JSON (de)serialization
    public Formula() {
    }

    public Formula(String expression) {
        this.expression = expression;
    }

    public Formula(String expression, FormulaType type, CellRange ref) {
        this.expression = expression;
        this.type = type;
        this.ref = ref;
    }

    public static Formula array(String expression, CellRange ref) {
        return new Formula(expression, FormulaType.ARRAY, ref);
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public FormulaType getType() {
        return type;
    }

    public void setType(FormulaType type) {
        this.type = type;
    }

    public CellRange getRef() {
        return ref;
    }

    public void setRef(CellRange ref) {
        this.ref = ref;
    }
}
