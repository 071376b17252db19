package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A service definition. The parent is only a name here; it is resolved when linking.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ServiceDefinition extends Definition {
    private String parentName;
    private int parentLine;
    private List<FunctionNode> functions = new ArrayList<>();

    @Builder
    public ServiceDefinition(String name, int sourceLine, String parentName, int parentLine,
                             List<FunctionNode> functions) {
        this.name = name;
        this.sourceLine = sourceLine;
        this.parentName = parentName;
        this.parentLine = parentLine;
        this.functions = functions != null ? functions : new ArrayList<>();
    }

    public boolean hasParent() {
        return parentName != null;
    }

    @Override
    public <T> T accept(DefinitionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
