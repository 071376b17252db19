package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct, union or exception definition with its ordered fields.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class StructDefinition extends Definition {
    private StructKind kind = StructKind.STRUCT;
    private List<FieldNode> fields = new ArrayList<>();

    @Builder
    public StructDefinition(String name, int sourceLine, StructKind kind, List<FieldNode> fields) {
        this.name = name;
        this.sourceLine = sourceLine;
        this.kind = kind != null ? kind : StructKind.STRUCT;
        this.fields = fields != null ? fields : new ArrayList<>();
    }

    @Override
    public <T> T accept(DefinitionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
