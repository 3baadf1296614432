package org.sheetcalc.engine.execution;

import org.sheetcalc.engine.dependency.DependencyInfo;
import org.sheetcalc.engine.dependency.DependencyRestoreData;
import org.sheetcalc.engine.function.FunctionRegistry;
import org.sheetcalc.engine.function.ParameterDefinition;
import org.sheetcalc.engine.function.ParameterType;
import org.sheetcalc.engine.function.SheetFunction;
import org.sheetcalc.engine.value.CellValue;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Formula Engine Tests")
class FormulaEngineTest {

    private FormulaSheet sheet;
    private FormulaEngine engine;
    private List<String> touched;
    private List<ValueChangedEvent> events;

    /**
     * TOUCH(value) returns its argument and records the call.
     */
    private final class Touch implements SheetFunction {

        @Override
        public List<ParameterDefinition> parameterDefinitions() {
            return List.of(ParameterDefinition.required("value", ParameterType.ANY));
        }

        @Override
        public CellValue call(CellValue[] args) {
            touched.add(args[0].toDisplayText());
            return args[0];
        }
    }

    @BeforeEach
    void setUp() {
        touched = new ArrayList<>();
        events = new ArrayList<>();
        FunctionRegistry functions = FunctionRegistry.withBuiltins();
        functions.registerFunction("TOUCH", new Touch());
        sheet = new FormulaSheet(FormulaOptions.defaults(), functions);
        engine = sheet.engine();
        engine.addValueChangedListener(events::add);
    }

    // ==================== Incremental calculation ====================

    @Test
    @DisplayName("Only formulas reading a changed cell are evaluated")
    void testIncrementalMinimality() {
        // GIVEN
        sheet.set("A1", 1);
        sheet.set("D1", 2);
        sheet.set("B1", "=TOUCH(A1)");
        sheet.set("C1", "=TOUCH(D1)");
        touched.clear();

        // WHEN
        sheet.set("A1", 5);

        // THEN
        assertEquals(List.of("5"), touched);
        assertEquals(5, sheet.get("B1").asNumber());
    }

    @Test
    @DisplayName("A full calculation evaluates every formula")
    void testFullCalculation() {
        sheet.set("B1", "=TOUCH(1)");
        sheet.set("C1", "=TOUCH(2)");
        touched.clear();

        engine.calculate(true);

        assertEquals(2, touched.size());
    }

    @Test
    @DisplayName("Calculating with nothing dirty evaluates nothing")
    void testNothingDirty() {
        sheet.set("B1", "=TOUCH(1)");
        touched.clear();

        engine.calculate(false);

        assertTrue(touched.isEmpty());
        assertFalse(engine.isCalculating());
    }

    // ==================== Listeners ====================

    @Test
    @DisplayName("Listeners hear about results that changed")
    void testValueChangedEvents() {
        sheet.set("A1", 1);
        sheet.set("B1", "=A1*2");
        events.clear();

        sheet.set("A1", 4);

        assertEquals(1, events.size());
        ValueChangedEvent event = events.get(0);
        assertEquals("B1", event.vertex().key());
        assertEquals(CellValue.number(2), event.oldValue());
        assertEquals(CellValue.number(8), event.newValue());
    }

    @Test
    @DisplayName("Results that did not change are not reported")
    void testUnchangedResult() {
        sheet.set("A1", 1);
        sheet.set("B1", "=A1*0");
        events.clear();

        sheet.set("A1", 7);

        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Removed listeners hear nothing")
    void testRemoveListener() {
        List<ValueChangedEvent> other = new ArrayList<>();
        ValueChangedListener listener = other::add;
        engine.addValueChangedListener(listener);
        engine.removeValueChangedListener(listener);

        sheet.set("B1", "=1");

        assertTrue(other.isEmpty());
        assertEquals(1, events.size());
    }

    @Test
    @DisplayName("Named formulas report changes too")
    void testNamedFormulaEvent() {
        sheet.defineName("Answer", "=6*7");

        assertEquals(1, events.size());
        assertEquals("ANSWER", events.get(0).vertex().key());
        assertEquals(CellValue.number(42), events.get(0).newValue());
    }

    // ==================== Restore ====================

    @Test
    @DisplayName("Restoring dependencies during a calculation is refused")
    void testRestoreWhileCalculating() {
        sheet.set("B1", "=A1+1");
        engine.addValueChangedListener(event -> engine.restore(new DependencyRestoreData()));

        assertThrows(IllegalStateException.class, () -> sheet.set("A1", 1));
        assertFalse(engine.isCalculating());
    }

    // ==================== Inspection ====================

    @Test
    @DisplayName("Formula detection and ad hoc evaluation")
    void testParseAndEvaluate() {
        sheet.set("A1", 3);

        assertTrue(FormulaEngine.isFormula("=A1"));
        assertFalse(FormulaEngine.isFormula("A1"));
        assertFalse(FormulaEngine.isFormula(3));
        assertEquals(CellValue.number(9), engine.evaluate(engine.parse("=A1*A1")));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Dependencies are listed as precedent and dependent keys")
    void testGetDependencies() {
        sheet.set("B1", "=A1+SUM(C1:C2)");

        List<DependencyInfo> dependencies = engine.getDependencies();

        assertEquals(2, dependencies.size());
        assertTrue(dependencies.contains(new DependencyInfo("A1", "B1")));
        assertTrue(dependencies.contains(new DependencyInfo("C1:C2", "B1")));
    }

    @Test
    @DisplayName("Options are validated")
    void testOptions() {
        assertThrows(IllegalArgumentException.class, () -> FormulaOptions.defaults().withMaxRepeatingArguments(0));
        assertEquals("Sheet1", engine.options().sheetName());
    }
}
