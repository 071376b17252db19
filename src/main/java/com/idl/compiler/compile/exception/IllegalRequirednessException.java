package com.idl.compiler.compile.exception;

/**
 * A union field was declared {@code required}.
 */
public class IllegalRequirednessException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public IllegalRequirednessException(String fieldName, int line) {
        super("field \"" + fieldName + "\" on line " + line + " cannot be required");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
