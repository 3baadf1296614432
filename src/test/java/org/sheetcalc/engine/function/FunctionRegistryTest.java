package org.sheetcalc.engine.function;

import org.sheetcalc.engine.value.CellValue;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Function Registry Tests")
class FunctionRegistryTest {

    private static SheetFunction withParameters(ParameterDefinition... parameters) {
        List<ParameterDefinition> definitions = List.of(parameters);
        return new SheetFunction() {
            @Override
            public List<ParameterDefinition> parameterDefinitions() {
                return definitions;
            }

            @Override
            public CellValue call(CellValue[] args) {
                return CellValue.number(args.length);
            }
        };
    }

    @Test
    @DisplayName("Names are case-insensitive")
    void testCaseInsensitiveLookup() {
        // GIVEN
        FunctionRegistry registry = new FunctionRegistry();
        SheetFunction function = withParameters(ParameterDefinition.required("x", ParameterType.NUMBER));

        // WHEN
        registry.registerFunction("Double", function);

        // THEN
        assertTrue(registry.functionExists("DOUBLE"));
        assertSame(function, registry.getDefinition("double"));
        assertFalse(registry.functionExists("TRIPLE"));
        assertNull(registry.getDefinition("TRIPLE"));
        assertNull(registry.getDefinition(null));
    }

    @Test
    @DisplayName("Registering a name again replaces the function")
    void testReplace() {
        FunctionRegistry registry = new FunctionRegistry();
        SheetFunction first = withParameters();
        SheetFunction second = withParameters();

        registry.registerFunction("F", first);
        registry.registerFunction("f", second);

        assertSame(second, registry.getDefinition("F"));
        assertEquals(1, registry.functionNames().size());
    }

    @Test
    @DisplayName("A required parameter may not follow an optional one")
    void testRequiredAfterOptional() {
        FunctionRegistry registry = new FunctionRegistry();
        SheetFunction function = withParameters(
                ParameterDefinition.optional("a", ParameterType.NUMBER),
                ParameterDefinition.required("b", ParameterType.NUMBER));

        InvalidFunctionDefinitionException e = assertThrows(InvalidFunctionDefinitionException.class,
                () -> registry.registerFunction("BAD", function));
        assertEquals("BAD", e.getFunctionName());
        assertFalse(registry.functionExists("BAD"));
    }

    @Test
    @DisplayName("Only the last parameter may repeat")
    void testRepeatingNotLast() {
        FunctionRegistry registry = new FunctionRegistry();
        SheetFunction function = withParameters(
                ParameterDefinition.repeating("values", ParameterType.NUMBER_SEQUENCE),
                ParameterDefinition.required("b", ParameterType.NUMBER));

        assertThrows(InvalidFunctionDefinitionException.class, () -> registry.registerFunction("BAD", function));
    }

    @Test
    @DisplayName("The built-in library is registered")
    void testBuiltins() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();

        for (String name : List.of("SUM", "AVERAGE", "MIN", "MAX", "POWER", "SIN", "IF", "AND", "OR", "NOT",
                "IFERROR", "ISERROR", "VLOOKUP", "SLOPE", "INTERCEPT")) {
            assertTrue(registry.functionExists(name), name);
        }
    }

    @Test
    @DisplayName("Parameter types carry their dimensionality")
    void testDimensionality() {
        assertEquals(ParameterDimensionality.SCALAR, ParameterDefinition.required("x", ParameterType.NUMBER).dimensionality());
        assertEquals(ParameterDimensionality.RANGE, ParameterDefinition.required("x", ParameterType.ARRAY).dimensionality());
        assertFalse(ParameterDefinition.optionalRepeating("x", ParameterType.ANY).isRequired());
    }
}
