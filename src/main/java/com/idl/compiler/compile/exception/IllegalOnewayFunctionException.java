package com.idl.compiler.compile.exception;

/**
 * A oneway function declared a return type or a throws list.
 */
public class IllegalOnewayFunctionException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    private IllegalOnewayFunctionException(String functionName, String reason) {
        super("oneway function \"" + functionName + "\" " + reason);
        this.functionName = functionName;
    }

    public static IllegalOnewayFunctionException returnsValue(String functionName) {
        return new IllegalOnewayFunctionException(functionName, "cannot return a value");
    }

    public static IllegalOnewayFunctionException throwsExceptions(String functionName) {
        return new IllegalOnewayFunctionException(functionName, "cannot throw exceptions");
    }

    public String getFunctionName() {
        return functionName;
    }
}
