package com.spreadsheet.formula.functions;

/**
 * Where a function is registered. EXTENDED holds functions introduced
 * after the 2007 file format (written with a "_xlfn." prefix);
 * it is consulted before STANDARD.
 */
public enum FunctionNamespace {
    STANDARD,
    EXTENDED
}
