package org.sheetcalc.engine.function.builtin;

import org.sheetcalc.engine.execution.FormulaSheet;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.ErrorType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in function library, evaluated against a sheet holding:
 * <pre>
 *      A   B   C         D
 *  1   1   2   "apple"   10
 *  2   2   4   "banana"  20
 *  3   3   6   "cherry"  30
 *  4   x
 * </pre>
 */
@DisplayName("Built-in Function Tests")
class BuiltinFunctionsTest {

    private FormulaSheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaSheet();
        Object[][] rows = {
                {1, 2, "apple", 10},
                {2, 4, "banana", 20},
                {3, 6, "cherry", 30}};
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < rows[r].length; c++) {
                sheet.setCellValue(r, c, rows[r][c]);
            }
        }
        sheet.set("A4", "x");
    }

    private CellValue eval(String formula) {
        return sheet.engine().evaluate(sheet.engine().parse(formula));
    }

    // ==================== Math ====================

    @ParameterizedTest(name = "{0} = {1}")
    @MethodSource("numericCases")
    @DisplayName("Numeric results")
    void testNumericResults(String formula, double expected) {
        CellValue result = eval(formula);

        assertFalse(result.isError(), () -> formula + " gave " + result.toDisplayText());
        assertEquals(expected, result.asNumber(), 1e-9);
    }

    static Stream<Arguments> numericCases() {
        return Stream.of(
                Arguments.of("=SUM(A1:A4)", 6),
                Arguments.of("=SUM(A1:A3, 10, TRUE)", 17),
                Arguments.of("=SUM(A4)", 0),
                Arguments.of("=AVERAGE(A1:B3)", 3),
                Arguments.of("=MIN(B1:B3, 3)", 2),
                Arguments.of("=MAX(A1:A3, D1)", 10),
                Arguments.of("=MAX(C1:C3)", 0),
                Arguments.of("=POWER(2, 10)", 1024),
                Arguments.of("=POWER(A3, 2)", 9),
                Arguments.of("=SIN(0)", 0),
                Arguments.of("=SLOPE(B1:B3, A1:A3)", 2),
                Arguments.of("=INTERCEPT(D1:D3, A1:A3)", 0),
                Arguments.of("=INTERCEPT(B1:B3, D1:D3)", 0),
                Arguments.of("=SLOPE(D1:D3, B1:B3)", 5));
    }

    @Test
    @DisplayName("Aggregates propagate the first error")
    void testAggregateErrors() {
        assertTrue(eval("=SUM(1, 1/0)").isError(ErrorType.DIV0));
        assertTrue(eval("=SUM(\"x\")").isError(ErrorType.VALUE));
        assertTrue(eval("=AVERAGE(C1:C3)").isError(ErrorType.DIV0));
        assertTrue(eval("=POWER(\"a\", 2)").isError(ErrorType.VALUE));
    }

    // ==================== Logical ====================

    @Nested
    @DisplayName("IF")
    class If {

        @Test
        @DisplayName("Chooses a branch by the condition")
        void testBranches() {
            assertEquals(CellValue.text("yes"), eval("=IF(A1>0, \"yes\", \"no\")"));
            assertEquals(CellValue.text("no"), eval("=IF(A1>5, \"yes\", \"no\")"));
            assertEquals(CellValue.number(20), eval("=IF(1, D2, D3)"));
        }

        @Test
        @DisplayName("A missing branch yields the condition's logical value")
        void testMissingBranch() {
            assertEquals(CellValue.logical(true), eval("=IF(TRUE)"));
            assertEquals(CellValue.logical(false), eval("=IF(FALSE, 1)"));
        }

        @Test
        @DisplayName("An error in the condition propagates")
        void testErrorCondition() {
            assertTrue(eval("=IF(1/0, 1, 2)").isError(ErrorType.DIV0));
            assertTrue(eval("=IF(\"maybe\", 1, 2)").isError(ErrorType.VALUE));
        }

        @Test
        @DisplayName("An error in the branch not taken is ignored")
        void testErrorInOtherBranch() {
            assertEquals(CellValue.number(1), eval("=IF(TRUE, 1, 1/0)"));
            assertTrue(eval("=IF(FALSE, 1, 1/0)").isError(ErrorType.DIV0));
        }
    }

    @Test
    @DisplayName("AND and OR")
    void testAndOr() {
        assertEquals(CellValue.logical(true), eval("=AND(TRUE, 1, A1:A3)"));
        assertEquals(CellValue.logical(false), eval("=AND(TRUE, 0)"));
        assertEquals(CellValue.logical(true), eval("=OR(FALSE, A1)"));
        assertEquals(CellValue.logical(false), eval("=OR(FALSE, FALSE)"));
    }

    @Test
    @DisplayName("AND and OR need at least one logical value")
    void testAndOrWithoutValues() {
        assertTrue(eval("=AND(C1:C3)").isError(ErrorType.VALUE));
        assertTrue(eval("=OR(F1:F5)").isError(ErrorType.VALUE));
    }

    @Test
    @DisplayName("NOT, IFERROR and ISERROR")
    void testErrorHandlingFunctions() {
        assertEquals(CellValue.logical(true), eval("=NOT(0)"));
        assertEquals(CellValue.logical(false), eval("=NOT(A1)"));
        assertEquals(CellValue.text("fallback"), eval("=IFERROR(1/0, \"fallback\")"));
        assertEquals(CellValue.number(2), eval("=IFERROR(A2, \"fallback\")"));
        assertEquals(CellValue.logical(true), eval("=ISERROR(A4*2)"));
        assertEquals(CellValue.logical(false), eval("=ISERROR(A1)"));
    }

    // ==================== Lookup ====================

    @Nested
    @DisplayName("VLOOKUP")
    class VLookup {

        @Test
        @DisplayName("Exact match returns the first matching row")
        void testExactMatch() {
            assertEquals(CellValue.number(20), eval("=VLOOKUP(2, A1:D3, 4, FALSE)"));
            assertEquals(CellValue.number(30), eval("=VLOOKUP(\"CHERRY\", C1:D3, 2, FALSE)"));
        }

        @Test
        @DisplayName("Range lookup returns the last row not greater than the value")
        void testApproximateMatch() {
            assertEquals(CellValue.number(20), eval("=VLOOKUP(2.5, A1:D3, 4)"));
            assertEquals(CellValue.number(30), eval("=VLOOKUP(100, A1:D3, 4, TRUE)"));
        }

        @Test
        @DisplayName("A missing value is #N/A")
        void testNotFound() {
            assertTrue(eval("=VLOOKUP(0.5, A1:D3, 2)").isError(ErrorType.NA));
            assertTrue(eval("=VLOOKUP(7, A1:D3, 2, FALSE)").isError(ErrorType.NA));
        }

        @Test
        @DisplayName("A column outside the table is #REF!")
        void testColumnOutOfRange() {
            assertTrue(eval("=VLOOKUP(2, A1:D3, 5, FALSE)").isError(ErrorType.REF));
            assertTrue(eval("=VLOOKUP(2, A1:D3, 0, FALSE)").isError(ErrorType.REF));
        }
    }

    // ==================== Statistics ====================

    @Test
    @DisplayName("Regression needs matching shapes and two distinct x values")
    void testRegressionErrors() {
        assertTrue(eval("=SLOPE(B1:B3, A1:A2)").isError(ErrorType.NA));
        assertTrue(eval("=SLOPE(B1, A1)").isError(ErrorType.DIV0));
        assertTrue(eval("=INTERCEPT(A1:A3, {5;5;5})").isError(ErrorType.DIV0));
    }

    @Test
    @DisplayName("Cells without a number on both sides are left out of the fit")
    void testRegressionSkipsNonNumbers() {
        // A4 holds text, so the fourth pair is ignored
        assertEquals(1, eval("=SLOPE(A1:A4, A1:A4)").asNumber(), 1e-9);
    }
}
