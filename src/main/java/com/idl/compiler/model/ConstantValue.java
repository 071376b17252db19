package com.idl.compiler.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for constant and default values. Values are kept as written; nothing evaluates them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class ConstantValue {
    protected int sourceLine;
}
