package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spreadsheet.formula.values.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * The literal value stored in a workbook cell.
 * The payload's Java type follows the kind:
 * - EMPTY: null
 * - STRING: String
 * - NUMBER: Double
 * - BOOLEAN: Boolean
 * - ERROR: ErrorCode
 * - DATE: Instant
 */
public class CellValue {

    private static final CellValue EMPTY = new CellValue(CellValueType.EMPTY, null);

    private final CellValueType type;
    private final Object value;

    private CellValue(CellValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Accepts the JSON form {"type": "number", "value": 42}.
     * Dates may be given as ISO instants ("2024-01-15T00:00:00Z")
     * or plain dates ("2024-01-15", taken as UTC midnight).
     */
    @JsonCreator
    public static CellValue fromJson(@JsonProperty("type") CellValueType type,
                                     @JsonProperty("value") Object value) {
        if (type == null || type == CellValueType.EMPTY) {
            return empty();
        }
        switch (type) {
            case STRING:
                return string(String.valueOf(value));
            case NUMBER:
                if (value instanceof Number) {
                    return number(((Number) value).doubleValue());
                }
                return number(Double.parseDouble(String.valueOf(value).trim()));
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return bool((Boolean) value);
                }
                return bool(Boolean.parseBoolean(String.valueOf(value).trim()));
            case ERROR:
                ErrorCode code = ErrorCode.fromText(String.valueOf(value).trim());
                if (code == null) {
                    throw new IllegalArgumentException("Unknown error value: " + value);
                }
                return error(code);
            case DATE:
                return date(parseInstant(String.valueOf(value).trim()));
            default:
                throw new IllegalArgumentException("Unsupported cell value type: " + type);
        }
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue string(String value) {
        return new CellValue(CellValueType.STRING, value);
    }

    public static CellValue number(double value) {
        return new CellValue(CellValueType.NUMBER, value);
    }

    public static CellValue bool(boolean value) {
        return new CellValue(CellValueType.BOOLEAN, value);
    }

    public static CellValue error(ErrorCode code) {
        return new CellValue(CellValueType.ERROR, code);
    }

    public static CellValue date(Instant value) {
        return new CellValue(CellValueType.DATE, value);
    }

    public CellValueType getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }
}
