package com.spreadsheet.formula.values;

/**
 * The kinds of single value a formula can hold.
 */
public enum ScalarType {
    BLANK,
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR
}
