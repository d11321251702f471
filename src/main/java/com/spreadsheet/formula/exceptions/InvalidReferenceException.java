package com.spreadsheet.formula.exceptions;

/**
 * Thrown when A1-style reference text can't be parsed,
 * e.g. "A0", "ZZZZ1" or "Sheet1!" with no address.
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
