package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An enum definition with its items in declaration order.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class EnumDefinition extends Definition {
    private List<EnumItemNode> items = new ArrayList<>();

    @Builder
    public EnumDefinition(String name, int sourceLine, List<EnumItemNode> items) {
        this.name = name;
        this.sourceLine = sourceLine;
        this.items = items != null ? items : new ArrayList<>();
    }

    @Override
    public <T> T accept(DefinitionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
