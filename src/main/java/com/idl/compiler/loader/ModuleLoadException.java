package com.idl.compiler.loader;

/**
 * An include could not be found, or includes form a cycle.
 */
public class ModuleLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModuleLoadException(String message) {
        super(message);
    }
}
