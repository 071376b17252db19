package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ListTypeNode extends TypeNode {
    private final TypeNode elementType;

    public ListTypeNode(TypeNode elementType, int sourceLine) {
        super(sourceLine);
        this.elementType = elementType;
    }
}
