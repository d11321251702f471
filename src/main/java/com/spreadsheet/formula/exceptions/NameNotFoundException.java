package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.values.ErrorCode;

/**
 * Thrown when a formula uses a defined name or table name
 * that the workbook doesn't declare.
 * For example, "Defined name TaxRate not found". Evaluates to #NAME?.
 */
public class NameNotFoundException extends FormulaErrorException {
    public NameNotFoundException(String message) {
        super(ErrorCode.NAME, message);
    }
}
