package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class BaseTypeNode extends TypeNode {
    private final BaseType baseType;

    public BaseTypeNode(BaseType baseType, int sourceLine) {
        super(sourceLine);
        this.baseType = baseType;
    }
}
