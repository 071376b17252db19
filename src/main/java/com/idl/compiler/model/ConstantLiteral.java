package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * A string, integer ({@link Long}), double or boolean literal.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ConstantLiteral extends ConstantValue {
    private final Object value;

    public ConstantLiteral(Object value, int sourceLine) {
        super(sourceLine);
        this.value = value;
    }
}
