package org.sheetcalc.engine.eval;

import org.sheetcalc.engine.execution.SheetEnvironment;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterDimensionality;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.store.SparseCellStore;
import org.sheetcalc.engine.value.CellValue;
import org.sheetcalc.engine.value.CellValueType;
import org.sheetcalc.engine.value.ErrorType;
import org.sheetcalc.formula.reference.CellReference;
import org.sheetcalc.formula.reference.RangeReference;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Coercion and Parameter Conversion Tests")
class CellValueCoercerTest {

    private SparseCellStore store;
    private CellValueCoercer coercer;
    private ParameterConverter converter;

    @BeforeEach
    void setUp() {
        store = new SparseCellStore("Sheet1");
        coercer = new CellValueCoercer(new SheetEnvironment(store, new FunctionRegistry()));
        converter = new ParameterConverter(coercer);

        // A1:A4 = 1, "x", TRUE, 4
        store.set(0, 0, CellValue.number(1));
        store.set(1, 0, CellValue.text("x"));
        store.set(2, 0, CellValue.logical(true));
        store.set(3, 0, CellValue.number(4));
    }

    private CellValue convert(CellValue argument, ParameterType type) {
        return converter.convert(argument, ParameterDefinition.required("value", type));
    }

    private static CellValue column(int top, int bottom) {
        return CellValue.reference(new RangeReference(new CellReference(top, 0), new CellReference(bottom, 0), null));
    }

    @Nested
    @DisplayName("Scalar coercion")
    class Scalars {

        @Test
        @DisplayName("To number")
        void testToNumber() {
            assertEquals(CellValue.number(0), coercer.toNumber(CellValue.EMPTY));
            assertEquals(CellValue.number(1), coercer.toNumber(CellValue.logical(true)));
            assertEquals(CellValue.number(12.5), coercer.toNumber(CellValue.text(" 12.5 ")));
            assertTrue(coercer.toNumber(CellValue.text("abc")).isError(ErrorType.VALUE));
            assertTrue(coercer.toNumber(CellValue.error(ErrorType.NA)).isError(ErrorType.NA));
        }

        @Test
        @DisplayName("Dates count days since 1899-12-30")
        void testDateSerial() {
            assertEquals(CellValue.number(45306), coercer.toNumber(CellValue.date(LocalDate.of(2024, 1, 15))));
            assertEquals(0.5, CellValueCoercer.toSerial(LocalDateTime.of(1899, 12, 30, 12, 0)), 1e-9);
            assertEquals(LocalDateTime.of(2024, 1, 15, 0, 0), CellValueCoercer.fromSerial(45306));
        }

        @Test
        @DisplayName("To logical")
        void testToLogical() {
            assertEquals(CellValue.logical(true), coercer.toLogical(CellValue.number(-3)));
            assertEquals(CellValue.logical(false), coercer.toLogical(CellValue.EMPTY));
            assertEquals(CellValue.logical(true), coercer.toLogical(CellValue.text("True")));
            assertTrue(coercer.toLogical(CellValue.text("yes")).isError(ErrorType.VALUE));
        }

        @Test
        @DisplayName("To text and date")
        void testToTextAndDate() {
            assertEquals(CellValue.text("2"), coercer.toText(CellValue.number(2)));
            assertEquals(CellValue.text("FALSE"), coercer.toText(CellValue.logical(false)));
            assertEquals(CellValue.date(LocalDate.of(2024, 1, 15)), coercer.toDate(CellValue.text("2024-01-15")));
            assertEquals(CellValue.date(LocalDate.of(1900, 1, 1)), coercer.toDate(CellValue.number(2)));
            assertTrue(coercer.toDate(CellValue.text("soon")).isError(ErrorType.VALUE));
        }

        @Test
        @DisplayName("A range in a scalar position collapses to its top-left cell")
        void testResolveScalar() {
            assertEquals(CellValue.number(1), coercer.resolveScalar(column(0, 3)));
            assertEquals(CellValue.EMPTY, coercer.resolveScalar(CellValue.array(new CellValue[0][0])));
        }
    }

    @Nested
    @DisplayName("Parameter conversion")
    class Parameters {

        @Test
        @DisplayName("Number sequences keep the numbers of a range and skip other cells")
        void testNumberSequenceFromRange() {
            CellValue converted = convert(column(0, 3), ParameterType.NUMBER_SEQUENCE);

            assertEquals(CellValueType.SEQUENCE, converted.type());
            assertArrayEquals(new CellValue[]{CellValue.number(1), CellValue.number(4)}, converted.asSequence());
        }

        @Test
        @DisplayName("A directly written scalar is coerced into a one element sequence")
        void testNumberSequenceFromScalar() {
            CellValue converted = convert(CellValue.text("3"), ParameterType.NUMBER_SEQUENCE);

            assertArrayEquals(new CellValue[]{CellValue.number(3)}, converted.asSequence());
            assertTrue(convert(CellValue.text("x"), ParameterType.NUMBER_SEQUENCE)
                    .asSequence()[0].isError(ErrorType.VALUE));
        }

        @Test
        @DisplayName("Text in a single referenced cell is skipped, not coerced")
        void testSingleCellReferenceSkipsText() {
            CellValue converted = convert(CellValue.reference(new CellReference(1, 0)), ParameterType.NUMBER_SEQUENCE);

            assertEquals(0, converted.asSequence().length);
        }

        @Test
        @DisplayName("Logical sequences take logicals and numbers")
        void testLogicalSequence() {
            CellValue converted = convert(column(0, 3), ParameterType.LOGICAL_SEQUENCE);

            assertArrayEquals(new CellValue[]{CellValue.logical(true), CellValue.logical(true), CellValue.logical(true)},
                    converted.asSequence());
        }

        @Test
        @DisplayName("Array parameters accept ranges and wrap scalars")
        void testArray() {
            assertEquals(4, convert(column(0, 3), ParameterType.ARRAY).asArray().length);
            assertEquals(1, convert(CellValue.number(5), ParameterType.ARRAY).asArray().length);
            assertEquals(0, convert(CellValue.EMPTY, ParameterType.ARRAY).asArray().length);
        }

        @Test
        @DisplayName("Scalar parameters coerce the top-left cell of a range")
        void testScalarFromRange() {
            assertEquals(CellValue.text("1"), convert(column(0, 3), ParameterType.TEXT));
            assertEquals(CellValue.number(1), convert(column(0, 3), ParameterType.NUMBER));
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = ParameterType.class, names = "ANY", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("Range parameters keep every cell of a range, scalar parameters keep one")
        void testDimensionalityDrivesConversion(ParameterType type) {
            // WHEN
            CellValue converted = convert(column(0, 3), type);

            // THEN
            if (type.dimensionality() == ParameterDimensionality.RANGE) {
                assertTrue(converted.type() == CellValueType.SEQUENCE || converted.type() == CellValueType.ARRAY,
                        () -> type + " gave " + converted.type());
            } else {
                assertNotEquals(CellValueType.SEQUENCE, converted.type());
                assertNotEquals(CellValueType.ARRAY, converted.type());
            }
        }
    }
}
