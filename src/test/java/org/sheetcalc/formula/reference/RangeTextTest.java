package org.sheetcalc.formula.reference;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Range Text Tests")
class RangeTextTest {

    @ParameterizedTest(name = "{0} -> column {1}")
    @CsvSource({"A, 0", "Z, 25", "AA, 26", "AZ, 51", "XFD, 16383"})
    @DisplayName("Column letters convert both ways")
    void testColumnLetters(String letters, int index) {
        assertEquals(index, RangeText.lettersToColumn(letters));
        assertEquals(letters, RangeText.columnToLetters(index));
    }

    @Test
    @DisplayName("Parse a cell address with fixed markers")
    void testParseCell() {
        CellReference cell = RangeText.parseCell("c$3", "Data");

        assertNotNull(cell);
        assertEquals(2, cell.row());
        assertEquals(2, cell.col());
        assertTrue(cell.rowFixed());
        assertFalse(cell.colFixed());
        assertEquals("Data", cell.sheetName());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"A", "1", "A0", "ABCD1", "A1B", "XFE1", "A1048577", "TaxRate"})
    @DisplayName("Text that is not an address inside the sheet is rejected")
    void testNotACell(String text) {
        assertNull(RangeText.parseCell(text, null));
    }

    @Test
    @DisplayName("Region text uses the span shorthand for whole rows and columns")
    void testRegionToText() {
        assertEquals("B3", RangeText.regionToText(Region.cell(2, 1)));
        assertEquals("A1:C4", RangeText.regionToText(new Region(0, 0, 3, 2)));
        assertEquals("2:4", RangeText.regionToText(Region.rows(1, 3)));
        assertEquals("B:D", RangeText.regionToText(Region.columns(1, 3)));
    }

    @Test
    @DisplayName("Defined names must not look like addresses or logicals")
    void testValidNames() {
        assertTrue(RangeText.isValidName("TaxRate"));
        assertTrue(RangeText.isValidName("_total.2024"));
        assertFalse(RangeText.isValidName("A1"));
        assertFalse(RangeText.isValidName("TRUE"));
        assertFalse(RangeText.isValidName("1st"));
        assertFalse(RangeText.isValidName("tax rate"));
    }

    @Test
    @DisplayName("Sheet prefixes are quoted only when needed")
    void testSheetPrefix() {
        assertEquals("", RangeText.sheetPrefix(null));
        assertEquals("Data!", RangeText.sheetPrefix("Data"));
        assertEquals("'My Sheet'!", RangeText.sheetPrefix("My Sheet"));
        assertEquals("'Bob''s'!", RangeText.sheetPrefix("Bob's"));
        assertEquals("'A1'!", RangeText.sheetPrefix("A1"));
    }
}
