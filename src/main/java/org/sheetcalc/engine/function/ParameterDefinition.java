package org.sheetcalc.engine.function;

import java.util.Objects;

/**
 * Describes one parameter of a sheet function.
 *
 * @param name        Display name
 * @param type        Type arguments are converted to
 * @param requirement Whether the argument may be omitted
 * @param repeating   Whether the parameter accepts any number of trailing arguments
 */
public record ParameterDefinition(
        String name,
        ParameterType type,
        ParameterRequirement requirement,
        boolean repeating) {

    public ParameterDefinition {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(type, "Parameter type cannot be null");
        Objects.requireNonNull(requirement, "Parameter requirement cannot be null");
    }

    public static ParameterDefinition required(String name, ParameterType type) {
        return new ParameterDefinition(name, type, ParameterRequirement.REQUIRED, false);
    }

    public static ParameterDefinition optional(String name, ParameterType type) {
        return new ParameterDefinition(name, type, ParameterRequirement.OPTIONAL, false);
    }

    /**
     * A required parameter that also absorbs every following argument, e.g. SUM(number1, ...).
     */
    public static ParameterDefinition repeating(String name, ParameterType type) {
        return new ParameterDefinition(name, type, ParameterRequirement.REQUIRED, true);
    }

    public static ParameterDefinition optionalRepeating(String name, ParameterType type) {
        return new ParameterDefinition(name, type, ParameterRequirement.OPTIONAL, true);
    }

    public boolean isRequired() {
        return requirement == ParameterRequirement.REQUIRED;
    }

    public ParameterDimensionality dimensionality() {
        return type.dimensionality();
    }
}
