package com.idl.compiler.compile.exception;

/**
 * Names the definition that owned the list in which a compile error occurred.
 * The original error stays available as the cause.
 */
public class WrappedCompileException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final String target;

    public WrappedCompileException(String target, CompileException cause) {
        super("cannot compile \"" + target + "\": " + cause.getMessage(), cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }

    /**
     * The innermost error, unwrapping every level of context.
     */
    public CompileException getRootCause() {
        CompileException current = this;
        while (current instanceof WrappedCompileException wrapped) {
            current = (CompileException) wrapped.getCause();
        }
        return current;
    }
}
