package com.spreadsheet.formula.exceptions;

/**
 * Thrown by the parser on malformed formula text.
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }

    public FormulaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
