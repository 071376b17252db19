package com.idl.compiler.compile.exception;

/**
 * A field that may not carry a default value (exception lists, unions) declared one.
 */
public class IllegalDefaultValueException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public IllegalDefaultValueException(String fieldName, int line) {
        super("field \"" + fieldName + "\" on line " + line + " cannot have a default value");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
