package com.idl.compiler.compile.exception;

/**
 * The same identifier was used twice in one namespace (a field group, a service body,
 * an enum or the top level of a file).
 */
public class DuplicateNameException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final int originalLine;

    public DuplicateNameException(String name, int originalLine) {
        super("the name \"" + name + "\" has already been used on line " + originalLine);
        this.name = name;
        this.originalLine = originalLine;
    }

    public String getName() {
        return name;
    }

    /**
     * Line of the first occurrence.
     */
    public int getOriginalLine() {
        return originalLine;
    }
}
