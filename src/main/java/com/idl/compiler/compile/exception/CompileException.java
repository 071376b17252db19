package com.idl.compiler.compile.exception;

/**
 * Base class for every semantic error raised while compiling or linking IDL definitions.
 */
public abstract class CompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CompileException(String message) {
        super(message);
    }

    protected CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
