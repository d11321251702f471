package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidReferenceException;

import java.util.Objects;

/**
 * A cell address together with the name of the sheet it lives on,
 * e.g. the origin of a formula or a parsed "Sheet2!B4".
 */
public final class SheetCellReference {

    private final String sheetName;
    private final CellAddress address;

    public SheetCellReference(String sheetName, CellAddress address) {
        this.sheetName = sheetName;
        this.address = Objects.requireNonNull(address, "address");
    }

    /**
     * Parses "Sheet2!B4" or "'My Sheet'!B4"; unqualified text such as "B4"
     * is placed on {@code defaultSheetName}. Ranges are rejected.
     */
    public static SheetCellReference parse(String text, String defaultSheetName) {
        CellRange range = CellRange.parse(text);
        if (!range.getStart().equals(range.getEnd())) {
            throw new InvalidReferenceException("Expected single cell reference, got " + text);
        }
        String sheetName = range.getSheetName() != null ? range.getSheetName() : defaultSheetName;
        return new SheetCellReference(sheetName, range.getStart());
    }

    public String getSheetName() {
        return sheetName;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SheetCellReference)) {
            return false;
        }
        SheetCellReference other = (SheetCellReference) o;
        return Objects.equals(sheetName, other.sheetName) && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetName, address);
    }

    @Override
    public String toString() {
        return sheetName == null ? address.toString() : sheetName + "!" + address;
    }
}
