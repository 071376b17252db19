package com.idl.compiler.compile.exception;

import java.util.List;

/**
 * A service inherits from itself, or a typedef resolves to itself.
 */
public class CyclicReferenceException extends CompileException {

    private static final long serialVersionUID = 1L;

    private final List<String> chain;

    public CyclicReferenceException(List<String> chain) {
        super("\"" + chain.get(0) + "\" refers back to itself: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    /**
     * Names along the cycle, starting and ending with the same name.
     */
    public List<String> getChain() {
        return chain;
    }
}
