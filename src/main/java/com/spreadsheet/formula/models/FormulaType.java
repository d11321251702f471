package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * NORMAL formulas produce one value for their own cell;
 * ARRAY formulas spill one matrix over their ref range.
 */
public enum FormulaType {
    NORMAL,
    ARRAY;

    @JsonCreator
    public static FormulaType fromValue(String value) {
        return FormulaType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
