package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.values.ErrorCode;

/**
 * Raised while evaluating a formula when the result is a spreadsheet error
 * (e.g. #DIV/0!, #REF!). It is caught at the nearest scalar-producing boundary
 * and turned back into an error value.
 */
public class FormulaErrorException extends RuntimeException {
    private final ErrorCode code;

    public FormulaErrorException(ErrorCode code) {
        this(code, code.getText());
    }

    public FormulaErrorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
