package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.values.ErrorCode;

/**
 * Thrown when a reference names a sheet that doesn't exist
 * in the workbook snapshot. Evaluates to #REF!.
 */
public class SheetNotFoundException extends FormulaErrorException {
    public SheetNotFoundException(String message) {
        super(ErrorCode.REF, message);
    }
}
