package org.sheetcalc.formula.dsl;

import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.dsl.ast.*;
import org.sheetcalc.formula.reference.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Formula parsing tests - no evaluation involved.
 *
 * Covers operator precedence, reference and name disambiguation, array constants,
 * diagnostics for malformed input, and canonical formatting.
 */
@DisplayName("Formula Parser Tests")
class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser(FunctionRegistry.withBuiltins(), SeparatorSettings.defaults());

    private FormulaExpression parseValid(String text) {
        CellFormula formula = parser.parse(text);
        assertTrue(formula.isValid(), () -> "Unexpected diagnostics: " + formula.diagnostics());
        return formula.expression();
    }

    // ==================== Precedence ====================

    @Nested
    @DisplayName("Operator precedence")
    class Precedence {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testMultiplicationOverAddition() {
            // WHEN
            FormulaExpression expr = parseValid("=1+2*3");

            // THEN
            BinaryExpression add = assertInstanceOf(BinaryExpression.class, expr);
            assertEquals(BinaryExpression.Operator.ADD, add.operator());
            BinaryExpression multiply = assertInstanceOf(BinaryExpression.class, add.right());
            assertEquals(BinaryExpression.Operator.MULTIPLY, multiply.operator());
        }

        @Test
        @DisplayName("Binary operators are left associative")
        void testLeftAssociative() {
            BinaryExpression outer = assertInstanceOf(BinaryExpression.class, parseValid("=1-2-3"));

            BinaryExpression inner = assertInstanceOf(BinaryExpression.class, outer.left());
            assertEquals(BinaryExpression.Operator.SUBTRACT, inner.operator());
            assertInstanceOf(LiteralExpression.class, outer.right());
        }

        @Test
        @DisplayName("Prefix minus binds tighter than power")
        void testNegationOverPower() {
            BinaryExpression power = assertInstanceOf(BinaryExpression.class, parseValid("=-A1^2"));

            assertEquals(BinaryExpression.Operator.POWER, power.operator());
            UnaryExpression negate = assertInstanceOf(UnaryExpression.class, power.left());
            assertEquals(UnaryExpression.Operator.NEGATE, negate.operator());
        }

        @Test
        @DisplayName("Concatenation binds tighter than comparison")
        void testConcatenationOverComparison() {
            BinaryExpression equal = assertInstanceOf(BinaryExpression.class, parseValid("=A1&B1=C1"));

            assertEquals(BinaryExpression.Operator.EQUAL, equal.operator());
            BinaryExpression concat = assertInstanceOf(BinaryExpression.class, equal.left());
            assertEquals(BinaryExpression.Operator.CONCAT, concat.operator());
        }

        @Test
        @DisplayName("Postfix percent applies to its operand only")
        void testPercent() {
            BinaryExpression multiply = assertInstanceOf(BinaryExpression.class, parseValid("=50%*2"));

            UnaryExpression percent = assertInstanceOf(UnaryExpression.class, multiply.left());
            assertTrue(percent.isPostfix());
        }
    }

    // ==================== References and names ====================

    @Nested
    @DisplayName("References and names")
    class References {

        @Test
        @DisplayName("References are collected in source order")
        void testReferenceOrder() {
            // WHEN
            CellFormula formula = parser.parse("=SUM(A1:B2,$C$3)+TaxRate");

            // THEN
            List<Reference> references = formula.references();
            assertEquals(3, references.size());
            assertEquals(ReferenceKind.RANGE, references.get(0).kind());
            CellReference cell = assertInstanceOf(CellReference.class, references.get(1));
            assertEquals(2, cell.row());
            assertEquals(2, cell.col());
            assertTrue(cell.rowFixed());
            assertTrue(cell.colFixed());
            assertEquals(ReferenceKind.NAMED, references.get(2).kind());
        }

        @Test
        @DisplayName("Cell ranges are normalised to start at the top-left corner")
        void testRangeNormalised() {
            CellFormula formula = parser.parse("=B2:A1");

            assertEquals("=A1:B2", formula.toFormulaString());
            assertEquals(new Region(0, 0, 1, 1), formula.references().get(0).region());
        }

        @Test
        @DisplayName("Row and column spans")
        void testRowAndColumnSpans() {
            CellFormula formula = parser.parse("=SUM(2:4)+SUM($B:D)");

            RowReference rows = assertInstanceOf(RowReference.class, formula.references().get(0));
            assertEquals(1, rows.startRow());
            assertEquals(3, rows.endRow());
            ColumnReference columns = assertInstanceOf(ColumnReference.class, formula.references().get(1));
            assertEquals("$B:D", columns.toAddressText());
        }

        @Test
        @DisplayName("Sheet qualifiers, quoted and plain")
        void testSheetQualifiers() {
            CellFormula formula = parser.parse("='My Sheet'!A1+Other!B2:C3");

            assertEquals("My Sheet", formula.references().get(0).sheetName());
            assertEquals("Other", formula.references().get(1).sheetName());
            assertEquals("='My Sheet'!A1+Other!B2:C3", formula.toFormulaString());
        }

        @Test
        @DisplayName("A sheet qualifier on the right side of a range applies to the range; the left side wins")
        void testRangeQualifierSides() {
            assertEquals("Sheet2", parser.parse("=A1:Sheet2!B2").references().get(0).sheetName());
            assertEquals("Sheet1", parser.parse("=Sheet1!A1:Sheet2!B2").references().get(0).sheetName());
        }

        @Test
        @DisplayName("TRUE and FALSE are logical literals, not names")
        void testLogicalLiterals() {
            LiteralExpression literal = assertInstanceOf(LiteralExpression.class, parseValid("=true"));

            assertTrue(literal.value().asLogical());
        }

        @Test
        @DisplayName("An identifier that is not an address is a name; invalid name syntax does not abort")
        void testNames() {
            NameExpression valid = assertInstanceOf(NameExpression.class, parseValid("=TaxRate"));
            assertTrue(valid.reference().validSyntax());

            NameExpression invalid = assertInstanceOf(NameExpression.class, parseValid("=$rate"));
            assertFalse(invalid.reference().validSyntax());
        }

        @Test
        @DisplayName("Function names are resolved against the registry when known")
        void testFunctionResolution() {
            FunctionCallExpression known = assertInstanceOf(FunctionCallExpression.class, parseValid("=sum(1)"));
            assertTrue(known.isResolved());

            FunctionCallExpression unknown = assertInstanceOf(FunctionCallExpression.class, parseValid("=NOPE(1)"));
            assertFalse(unknown.isResolved());
            assertEquals("NOPE", unknown.name());
        }

        @Test
        @DisplayName("A parser without a registry leaves every call unresolved")
        void testNoRegistry() {
            FunctionCallExpression call = assertInstanceOf(FunctionCallExpression.class,
                    new FormulaParser().parse("=SUM(1)").expression());

            assertFalse(call.isResolved());
        }
    }

    // ==================== Array constants ====================

    @Nested
    @DisplayName("Array constants")
    class ArrayConstants {

        @Test
        @DisplayName("Rows and columns follow the separators")
        void testShape() {
            ArrayConstantExpression array = assertInstanceOf(ArrayConstantExpression.class, parseValid("={1,2,3;4,5,-6}"));

            assertEquals(2, array.height());
            assertEquals(3, array.width());
            assertEquals(-6.0, array.rows().get(1).get(2).value().asNumber());
        }

        @Test
        @DisplayName("Rows of unequal length record a diagnostic")
        void testUnequalRows() {
            // WHEN
            CellFormula formula = parser.parse("={1,2;3}");

            // THEN
            assertFalse(formula.isValid());
            assertTrue(formula.diagnostics().get(0).contains("Array constant rows"));
            LiteralExpression literal = assertInstanceOf(LiteralExpression.class, formula.expression());
            assertTrue(literal.value().isError(ErrorType.VALUE));
        }

        @Test
        @DisplayName("References are not allowed inside array constants")
        void testReferenceInArray() {
            CellFormula formula = parser.parse("={1,A1}");

            assertFalse(formula.isValid());
            assertTrue(formula.diagnostics().get(0).contains("only contain literals"));
        }
    }

    // ==================== Diagnostics ====================

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedFormulas")
    @DisplayName("Malformed formulas produce a diagnostic and an evaluable error node")
    void testMalformed(String text, String expectedMessage) {
        // WHEN
        CellFormula formula = assertDoesNotThrow(() -> parser.parse(text));

        // THEN
        assertFalse(formula.isValid());
        assertTrue(formula.diagnostics().stream().anyMatch(d -> d.contains(expectedMessage)),
                () -> "Diagnostics were " + formula.diagnostics());
        assertInstanceOf(LiteralExpression.class, formula.expression());
        assertEquals(text, formula.toFormulaString());
    }

    static Stream<Arguments> malformedFormulas() {
        return Stream.of(
                Arguments.of("1+2", "Formula must start with '='"),
                Arguments.of("=1+", "Unexpected end of formula"),
                Arguments.of("=SUM(1,2", "Expected ')' to close SUM("),
                Arguments.of("=1 2", "Unexpected '2'"),
                Arguments.of("=(1+2", "Expected ')'"),
                Arguments.of("=Other!Total", "is not a cell address on sheet 'Other'"));
    }

    @Test
    @DisplayName("Diagnostics give the position where parsing stopped")
    void testDiagnosticPosition() {
        assertEquals(List.of("Unexpected '2' at position 3"), parser.parse("=1 2").diagnostics());
        assertEquals(List.of("Unexpected end of formula at position 3"), parser.parse("=1+").diagnostics());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"=1E400", "=A1+1E400", "={1,-1E400}"})
    @DisplayName("Numbers beyond the double range are #NUM! with a diagnostic")
    void testNumberOutOfRange(String text) {
        // WHEN
        CellFormula formula = parser.parse(text);

        // THEN
        assertFalse(formula.isValid());
        assertTrue(formula.diagnostics().get(0).contains("out of range"), () -> formula.diagnostics().toString());
        LiteralExpression literal = assertInstanceOf(LiteralExpression.class, formula.expression());
        assertTrue(literal.value().isError(ErrorType.NUM));
        assertTrue(formula.references().isEmpty());
    }

    @Test
    @DisplayName("A formula with a diagnostic carries no references even where part of it parsed")
    void testInvalidFormulaHasNoReferences() {
        CellFormula formula = parser.parse("=IF(A1>0,1,{1;2,3})");

        assertFalse(formula.isValid());
        assertTrue(formula.references().isEmpty());
        assertEquals("=IF(A1>0,1,{1;2,3})", formula.toFormulaString());
    }

    @Test
    @DisplayName("Lexical errors become diagnostics")
    void testLexicalErrorsReported() {
        CellFormula formula = parser.parse("=\"open");

        assertFalse(formula.isValid());
        assertTrue(formula.diagnostics().get(0).startsWith("Unterminated string"));
    }

    // ==================== Formatting ====================

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "=SUM(A1:B2,1.5)",
            "=$A$1+B$2*-C3",
            "='My Sheet'!A1:B2",
            "=Other!$C:$D",
            "=SUM(2:4)",
            "=IF(A1>=10%,\"big\",\"small\")",
            "={1,2;3,-4}",
            "=TaxRate*2",
            "=(A1+B1)/2",
            "=#REF!+1",
            "=A1&\"say \"\"hi\"\"\"",
            "=A1<>TRUE"
    })
    @DisplayName("Formatting and reparsing keeps the text and references")
    void testRoundTrip(String text) {
        // GIVEN
        CellFormula first = parser.parse(text);

        // WHEN
        CellFormula second = parser.parse(first.toFormulaString());

        // THEN
        assertTrue(second.isValid());
        assertEquals(text, first.toFormulaString());
        assertEquals(first.toFormulaString(), second.toFormulaString());
        assertEquals(first.references(), second.references());
    }

    @Test
    @DisplayName("An out of range number keeps its text and its meaning when reparsed")
    void testRoundTripOutOfRangeNumber() {
        CellFormula first = parser.parse("=1E400");

        CellFormula second = parser.parse(first.toFormulaString());

        assertEquals("=1E400", first.toFormulaString());
        assertEquals(first.toFormulaString(), second.toFormulaString());
        assertEquals(first.diagnostics(), second.diagnostics());
    }

    @Test
    @DisplayName("Whitespace is dropped from the canonical text")
    void testCanonicalWhitespace() {
        assertEquals("=SUM(A1,B1)+1", parser.parse("= SUM( A1 , B1 ) + 1").toFormulaString());
    }

    @Test
    @DisplayName("Comma-decimal formulas format with their own separators")
    void testCommaDecimalRoundTrip() {
        // GIVEN
        FormulaParser commaParser = new FormulaParser(FunctionRegistry.withBuiltins(), SeparatorSettings.commaDecimal());

        // WHEN
        CellFormula formula = commaParser.parse("=SUM(1,5;{1\\2;3\\4})");

        // THEN
        assertTrue(formula.isValid(), () -> formula.diagnostics().toString());
        assertEquals("=SUM(1,5;{1\\2;3\\4})", formula.toFormulaString());
        FunctionCallExpression sum = assertInstanceOf(FunctionCallExpression.class, formula.expression());
        assertEquals(2, sum.arguments().size());
    }
}
