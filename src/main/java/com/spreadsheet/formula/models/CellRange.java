package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rectangular block of cells, optionally qualified by a sheet name.
 * Start may come after end; callers normalize with the min/max getters.
 * A 3-D range carries its sheet span as "First:Last" in the sheet name.
 */
public final class CellRange {

    private static final Pattern COLUMN_PATTERN = Pattern.compile("^(\\$)?([A-Za-z]{1,3})$");
    private static final Pattern ROW_PATTERN = Pattern.compile("^(\\$)?(\\d+)$");

    private final CellAddress start;
    private final CellAddress end;
    private final String sheetName;

    public CellRange(CellAddress start, CellAddress end) {
        this(start, end, null);
    }

    public CellRange(CellAddress start, CellAddress end, String sheetName) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.sheetName = sheetName;
    }

    /**
     * Parses range text: "A1:C3", "$A$1", "Sheet1!A1:B2", "'My Sheet'!A:A", "1:3".
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CellRange parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidReferenceException("Empty range reference");
        }
        String trimmed = text.trim();
        String sheetName = null;
        String body = trimmed;

        int bang = trimmed.lastIndexOf('!');
        if (bang >= 0) {
            sheetName = unquoteSheetName(trimmed.substring(0, bang));
            body = trimmed.substring(bang + 1);
            if (sheetName.isEmpty()) {
                throw new InvalidReferenceException("Missing sheet name in " + text);
            }
        }

        int colon = body.indexOf(':');
        if (colon < 0) {
            CellAddress address = CellAddress.parse(body);
            return new CellRange(address, address, sheetName);
        }

        String left = body.substring(0, colon);
        String right = body.substring(colon + 1);

        Matcher leftColumn = COLUMN_PATTERN.matcher(left);
        Matcher rightColumn = COLUMN_PATTERN.matcher(right);
        if (leftColumn.matches() && rightColumn.matches()) {
            return new CellRange(
                    new CellAddress(CellAddress.columnLettersToIndex(leftColumn.group(2)), 1,
                            leftColumn.group(1) != null, true),
                    new CellAddress(CellAddress.columnLettersToIndex(rightColumn.group(2)), CellAddress.MAX_ROWS,
                            rightColumn.group(1) != null, true),
                    sheetName);
        }

        Matcher leftRow = ROW_PATTERN.matcher(left);
        Matcher rightRow = ROW_PATTERN.matcher(right);
        if (leftRow.matches() && rightRow.matches()) {
            return new CellRange(
                    new CellAddress(1, CellAddress.parseRowNumber(leftRow.group(2)), true, leftRow.group(1) != null),
                    new CellAddress(CellAddress.MAX_COLUMNS, CellAddress.parseRowNumber(rightRow.group(2)),
                            true, rightRow.group(1) != null),
                    sheetName);
        }

        return new CellRange(CellAddress.parse(left), CellAddress.parse(right), sheetName);
    }

    /**
     * Same as {@link #parse(String)} but returns null instead of throwing.
     */
    public static CellRange tryParse(String text) {
        try {
            return parse(text);
        } catch (InvalidReferenceException e) {
            return null;
        }
    }

    /**
     * Strips the quotes of 'My Sheet' and un-doubles embedded quotes.
     */
    public static String unquoteSheetName(String raw) {
        String trimmed = raw.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'");
        }
        return trimmed;
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getMinRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getMaxRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public int getMinColumn() {
        return Math.min(start.getColumn(), end.getColumn());
    }

    public int getMaxColumn() {
        return Math.max(start.getColumn(), end.getColumn());
    }

    /**
     * The top-left corner of the normalized range.
     */
    public CellAddress getTopLeft() {
        return new CellAddress(getMinColumn(), getMinRow());
    }

    @JsonValue
    @Override
    public String toString() {
        String body = start.equals(end) ? start.toString() : start + ":" + end;
        if (sheetName == null) {
            return body;
        }
        boolean plain = sheetName.matches("[A-Za-z0-9_.:]+");
        return (plain ? sheetName : "'" + sheetName.replace("'", "''") + "'") + "!" + body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return start.equals(other.start) && end.equals(other.end) && Objects.equals(sheetName, other.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, sheetName);
    }
}
