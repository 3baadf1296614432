package org.sheetcalc.engine.function;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.MutableMap;
import org.sheetcalc.engine.function.builtin.BuiltinFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Name-keyed table of sheet functions. Names are case-insensitive.
 */
public final class FunctionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionRegistry.class);

    private final MutableMap<String, SheetFunction> functions = Maps.mutable.empty();

    /**
     * A registry holding the built-in function library.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        BuiltinFunctions.registerAll(registry);
        return registry;
    }

    /**
     * Registers or replaces a function.
     *
     * @throws InvalidFunctionDefinitionException if a required parameter follows an optional one,
     *                                            or a parameter other than the last repeats
     */
    public void registerFunction(String name, SheetFunction function) {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(function, "Function cannot be null");
        validate(name, function.parameterDefinitions());

        SheetFunction previous = functions.put(normalize(name), function);
        if (previous != null) {
            LOGGER.debug("Replaced function {}", name);
        }
    }

    public boolean functionExists(String name) {
        return name != null && functions.containsKey(normalize(name));
    }

    /**
     * @return the function, or null if no function has this name
     */
    public SheetFunction getDefinition(String name) {
        return name == null ? null : functions.get(normalize(name));
    }

    public Set<String> functionNames() {
        return functions.keysView().toSortedSet();
    }

    private static void validate(String name, List<ParameterDefinition> parameters) {
        boolean seenOptional = false;
        for (int i = 0; i < parameters.size(); i++) {
            ParameterDefinition parameter = parameters.get(i);
            if (parameter.isRequired() && seenOptional) {
                throw new InvalidFunctionDefinitionException(name,
                        "required parameter '" + parameter.name() + "' follows an optional parameter");
            }
            if (parameter.repeating() && i != parameters.size() - 1) {
                throw new InvalidFunctionDefinitionException(name,
                        "only the last parameter may repeat, but '" + parameter.name() + "' does");
            }
            seenOptional |= !parameter.isRequired();
        }
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
