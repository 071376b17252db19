package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * {@code const <type> <name> = <value>}
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ConstantDefinition extends Definition {
    private TypeNode type;
    private ConstantValue value;

    @Builder
    public ConstantDefinition(String name, int sourceLine, TypeNode type, ConstantValue value) {
        this.name = name;
        this.sourceLine = sourceLine;
        this.type = type;
        this.value = value;
    }

    @Override
    public <T> T accept(DefinitionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
