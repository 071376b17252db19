package com.idl.compiler.model;

/**
 * Requiredness declared on a field, if any.
 */
public enum Requiredness {
    REQUIRED,
    OPTIONAL,
    UNSPECIFIED
}
