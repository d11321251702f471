package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single cell position: 1-based column and row, plus the "$" flags
 * that only matter when the reference is written back as text.
 */
public final class CellAddress {

    public static final int MAX_ROWS = 1048576;
    public static final int MAX_COLUMNS = 16384;

    // "B7", "$B$7", "b$7"
    private static final Pattern A1_PATTERN = Pattern.compile("^(\\$)?([A-Za-z]{1,3})(\\$)?(\\d+)$");

    private final int column;
    private final int row;
    private final boolean columnAbsolute;
    private final boolean rowAbsolute;

    public CellAddress(int column, int row) {
        this(column, row, false, false);
    }

    public CellAddress(int column, int row, boolean columnAbsolute, boolean rowAbsolute) {
        if (column < 1 || row < 1) {
            throw new InvalidReferenceException("Cell indices are 1-based, got column " + column + ", row " + row);
        }
        this.column = column;
        this.row = row;
        this.columnAbsolute = columnAbsolute;
        this.rowAbsolute = rowAbsolute;
    }

    /**
     * Parses A1 text such as "C12" or "$C$12".
     * Throws InvalidReferenceException on anything else.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CellAddress parse(String text) {
        Matcher matcher = A1_PATTERN.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new InvalidReferenceException("Not a cell reference: " + text);
        }
        int column = columnLettersToIndex(matcher.group(2));
        int row = parseRowNumber(matcher.group(4));
        if (column > MAX_COLUMNS || row > MAX_ROWS) {
            throw new InvalidReferenceException("Cell reference out of bounds: " + text);
        }
        return new CellAddress(column, row, matcher.group(1) != null, matcher.group(3) != null);
    }

    /**
     * "A" -> 1, "Z" -> 26, "AA" -> 27, "XFD" -> 16384.
     */
    public static int columnLettersToIndex(String letters) {
        int index = 0;
        for (char c : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            if (c < 'A' || c > 'Z') {
                throw new InvalidReferenceException("Not a column name: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        if (index < 1) {
            throw new InvalidReferenceException("Not a column name: " + letters);
        }
        return index;
    }

    public static String columnIndexToLetters(int column) {
        StringBuilder sb = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            sb.insert(0, (char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return sb.toString();
    }

    static int parseRowNumber(String digits) {
        try {
            int row = Integer.parseInt(digits);
            if (row < 1) {
                throw new InvalidReferenceException("Row numbers start at 1, got " + digits);
            }
            return row;
        } catch (NumberFormatException e) {
            throw new InvalidReferenceException("Row number out of range: " + digits);
        }
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    @JsonValue
    @Override
    public String toString() {
        return (columnAbsolute ? "$" : "") + columnIndexToLetters(column) + (rowAbsolute ? "$" : "") + row;
    }

    // Absolute flags don't change which cell is addressed
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return column == other.column && row == other.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }
}
