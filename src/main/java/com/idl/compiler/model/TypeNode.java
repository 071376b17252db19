package com.idl.compiler.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for type references as written in the source.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class TypeNode {
    protected int sourceLine;
}
