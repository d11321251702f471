package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.values.ErrorCode;

/**
 * Thrown when resolving a cell or defined name re-enters itself
 * (e.g., a name whose formula refers back to the same name,
 * or a multi-name loop). Evaluates to #REF!.
 */
public class CircularReferenceException extends FormulaErrorException {
    public CircularReferenceException(String message) {
        super(ErrorCode.REF, message);
    }
}
