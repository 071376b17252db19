package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Reference to another definition by name, possibly qualified by an include ({@code shared.Foo}).
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class TypeReferenceNode extends TypeNode {
    private final String name;

    public TypeReferenceNode(String name, int sourceLine) {
        super(sourceLine);
        this.name = name;
    }
}
