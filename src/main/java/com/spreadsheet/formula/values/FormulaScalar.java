package com.spreadsheet.formula.values;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Objects;

/**
 * A single formula value: blank, number, text, boolean or error.
 * Instances are immutable; use the static factories to create them.
 */
public final class FormulaScalar extends EvalResult {

    private static final FormulaScalar BLANK = new FormulaScalar(ScalarType.BLANK, null);
    private static final FormulaScalar TRUE = new FormulaScalar(ScalarType.BOOLEAN, Boolean.TRUE);
    private static final FormulaScalar FALSE = new FormulaScalar(ScalarType.BOOLEAN, Boolean.FALSE);

    private final ScalarType type;
    private final Object value;

    private FormulaScalar(ScalarType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static FormulaScalar blank() {
        return BLANK;
    }

    public static FormulaScalar number(double value) {
        // -0.0 and 0.0 are the same spreadsheet value
        return new FormulaScalar(ScalarType.NUMBER, value == 0.0 ? 0.0 : value);
    }

    public static FormulaScalar text(String value) {
        return new FormulaScalar(ScalarType.TEXT, Objects.requireNonNull(value, "value"));
    }

    public static FormulaScalar bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FormulaScalar error(ErrorCode code) {
        return new FormulaScalar(ScalarType.ERROR, Objects.requireNonNull(code, "code"));
    }

    @Override
    public boolean isArray() {
        return false;
    }

    public ScalarType getType() {
        return type;
    }

    public boolean isBlank() {
        return type == ScalarType.BLANK;
    }

    public boolean isNumber() {
        return type == ScalarType.NUMBER;
    }

    public boolean isText() {
        return type == ScalarType.TEXT;
    }

    public boolean isBoolean() {
        return type == ScalarType.BOOLEAN;
    }

    public boolean isError() {
        return type == ScalarType.ERROR;
    }

    public double getNumber() {
        requireType(ScalarType.NUMBER);
        return (Double) value;
    }

    public String getText() {
        requireType(ScalarType.TEXT);
        return (String) value;
    }

    public boolean getBoolean() {
        requireType(ScalarType.BOOLEAN);
        return (Boolean) value;
    }

    public ErrorCode getErrorCode() {
        requireType(ScalarType.ERROR);
        return (ErrorCode) value;
    }

    private void requireType(ScalarType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " scalar, got " + type);
        }
    }

    /**
     * JSON form: blank as null, primitives as themselves,
     * errors as {"error": "#REF!"}.
     */
    @JsonValue
    public Object toJson() {
        if (type == ScalarType.ERROR) {
            return Collections.singletonMap("error", ((ErrorCode) value).getText());
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaScalar)) {
            return false;
        }
        FormulaScalar other = (FormulaScalar) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case BLANK:
                return "<blank>";
            case TEXT:
                return "\"" + value + "\"";
            case ERROR:
                return ((ErrorCode) value).getText();
            default:
                return String.valueOf(value);
        }
    }
}
