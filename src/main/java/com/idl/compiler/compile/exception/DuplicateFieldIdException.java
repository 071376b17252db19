package com.idl.compiler.compile.exception;

/**
 * Two fields of the same group resolved to the same field id.
 */
public class DuplicateFieldIdException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final int id;
    private final String originalFieldName;
    private final int originalLine;

    public DuplicateFieldIdException(String fieldName, int line, int id, String originalFieldName, int originalLine) {
        super("field \"" + fieldName + "\" on line " + line + " has the ID " + id
                + " already used by \"" + originalFieldName + "\" on line " + originalLine);
        this.fieldName = fieldName;
        this.id = id;
        this.originalFieldName = originalFieldName;
        this.originalLine = originalLine;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getId() {
        return id;
    }

    public String getOriginalFieldName() {
        return originalFieldName;
    }

    public int getOriginalLine() {
        return originalLine;
    }
}
