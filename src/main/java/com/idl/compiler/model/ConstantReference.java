package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * A reference to another constant or an enum item, e.g. {@code Status.ACTIVE}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ConstantReference extends ConstantValue {
    private final String name;

    public ConstantReference(String name, int sourceLine) {
        super(sourceLine);
        this.name = name;
    }
}
