package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class MapTypeNode extends TypeNode {
    private final TypeNode keyType;
    private final TypeNode valueType;

    public MapTypeNode(TypeNode keyType, TypeNode valueType, int sourceLine) {
        super(sourceLine);
        this.keyType = keyType;
        this.valueType = valueType;
    }
}
