package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * {@code typedef <target> <name>}
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class TypedefDefinition extends Definition {
    private TypeNode target;

    @Builder
    public TypedefDefinition(String name, int sourceLine, TypeNode target) {
        this.name = name;
        this.sourceLine = sourceLine;
        this.target = target;
    }

    @Override
    public <T> T accept(DefinitionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
