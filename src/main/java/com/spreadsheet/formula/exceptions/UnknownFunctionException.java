package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a formula calls a function that is not registered.
 * This points at a missing registry entry rather than a bad formula,
 * so it is never converted into a spreadsheet error value.
 */
public class UnknownFunctionException extends RuntimeException {
    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function \"" + functionName + "\"");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
