package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Enumerates the kinds of literal value a workbook cell can store:
 * EMPTY, STRING, NUMBER, BOOLEAN, ERROR, DATE.
 */
public enum CellValueType {
    EMPTY,
    STRING,
    NUMBER,
    BOOLEAN,
    ERROR,
    DATE;

    /**
     * Allows case-insensitive JSON input.
     * For example, "number" -> NUMBER, "Date" -> DATE, etc.
     */
    @JsonCreator
    public static CellValueType fromValue(String value) {
        return CellValueType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
