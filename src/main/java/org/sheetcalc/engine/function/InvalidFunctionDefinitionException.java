package org.sheetcalc.engine.function;

/**
 * Thrown when a function is registered with an inconsistent parameter list.
 */
public class InvalidFunctionDefinitionException extends RuntimeException {

    private final String functionName;

    public InvalidFunctionDefinitionException(String functionName, String message) {
        super("Invalid definition of function " + functionName + ": " + message);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
