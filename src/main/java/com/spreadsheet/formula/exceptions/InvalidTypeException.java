package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.values.ErrorCode;

/**
 * Thrown when an operand can't be coerced to the type an operator needs
 * (e.g., "abc" used in arithmetic, or comparing a number with text).
 * Evaluates to #VALUE!.
 */
public class InvalidTypeException extends FormulaErrorException {
    public InvalidTypeException(String message) {
        super(ErrorCode.VALUE, message);
    }
}
