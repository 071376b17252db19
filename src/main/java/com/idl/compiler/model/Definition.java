package com.idl.compiler.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for all top-level IDL definitions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class Definition {
    protected String name;
    protected int sourceLine;

    public abstract <T> T accept(DefinitionVisitor<T> visitor);
}
