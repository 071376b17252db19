package com.idl.compiler.compile;

/**
 * Lifecycle of a named spec. Transitions only move forward.
 */
public enum SpecState {
    /** Compiled; may still hold unresolved references. */
    COMPILED,
    /** Link in progress; reaching it again means a reference cycle. */
    LINKING,
    /** Fully resolved and read-only. */
    LINKED,
    /** Linking failed; the spec must not be used. */
    FAILED
}
