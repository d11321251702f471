package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellRangeTest {

    @Test
    void testParseCellAddress() {
        CellAddress address = CellAddress.parse("$b$12");
        assertEquals(2, address.getColumn());
        assertEquals(12, address.getRow());
        assertTrue(address.isColumnAbsolute());
        assertTrue(address.isRowAbsolute());
        assertEquals(new CellAddress(2, 12), address);
        assertEquals("$B$12", address.toString());
    }

    @Test
    void testColumnLetters() {
        assertEquals(1, CellAddress.columnLettersToIndex("A"));
        assertEquals(27, CellAddress.columnLettersToIndex("AA"));
        assertEquals(16384, CellAddress.columnLettersToIndex("XFD"));
        assertEquals("XFD", CellAddress.columnIndexToLetters(16384));
        assertEquals("AZ", CellAddress.columnIndexToLetters(52));
    }

    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidReferenceException.class, () -> CellAddress.parse("A0"));
        assertThrows(InvalidReferenceException.class, () -> CellAddress.parse("XFE1"));
        assertThrows(InvalidReferenceException.class, () -> CellAddress.parse("A1048577"));
        assertThrows(InvalidReferenceException.class, () -> CellAddress.parse("1A"));
    }

    @Test
    void testParseRange() {
        CellRange range = CellRange.parse("C3:A1");
        assertNull(range.getSheetName());
        assertEquals(1, range.getMinRow());
        assertEquals(3, range.getMaxRow());
        assertEquals(1, range.getMinColumn());
        assertEquals(3, range.getMaxColumn());
        assertEquals(new CellAddress(1, 1), range.getTopLeft());
    }

    @Test
    void testParseSheetQualified() {
        CellRange plain = CellRange.parse("Data!A1:B2");
        assertEquals("Data", plain.getSheetName());

        CellRange quoted = CellRange.parse("'Bob''s Sheet'!$A$1");
        assertEquals("Bob's Sheet", quoted.getSheetName());
        assertEquals(quoted.getStart(), quoted.getEnd());
        assertEquals("'Bob''s Sheet'!$A$1", quoted.toString());
    }

    @Test
    void testWholeColumnsAndRows() {
        CellRange columns = CellRange.parse("B:D");
        assertEquals(2, columns.getMinColumn());
        assertEquals(4, columns.getMaxColumn());
        assertEquals(1, columns.getMinRow());
        assertEquals(CellAddress.MAX_ROWS, columns.getMaxRow());

        CellRange rows = CellRange.parse("2:5");
        assertEquals(2, rows.getMinRow());
        assertEquals(5, rows.getMaxRow());
        assertEquals(CellAddress.MAX_COLUMNS, rows.getMaxColumn());
    }

    @Test
    void testTryParse() {
        assertNull(CellRange.tryParse("SUM(A1:A3)"));
        assertNull(CellRange.tryParse("Sheet1!A1*2"));
        assertNull(CellRange.tryParse(""));
        assertNull(CellRange.tryParse("!A1"));
        assertEquals(CellRange.parse("A1:A3"), CellRange.tryParse(" A1:A3 "));
    }
}
