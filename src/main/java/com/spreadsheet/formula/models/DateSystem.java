package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The workbook's date epoch. Only date functions care about it;
 * the evaluator just hands it through.
 */
public enum DateSystem {
    SYSTEM_1900("1900"),
    SYSTEM_1904("1904");

    private final String label;

    DateSystem(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts "1900"/"1904" as well as the constant names.
     */
    @JsonCreator
    public static DateSystem fromValue(String value) {
        for (DateSystem system : values()) {
            if (system.label.equals(value.trim()) || system.name().equalsIgnoreCase(value.trim())) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unknown date system: " + value);
    }
}
