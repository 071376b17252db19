package com.idl.compiler.compile.exception;

/**
 * Linking could not find a referenced name in scope.
 */
public class UnresolvedReferenceException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final int line;

    public UnresolvedReferenceException(String name, int line) {
        super(name + " is not defined on line " + line);
        this.name = name;
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }
}
