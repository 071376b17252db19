package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A function of a service. A null return type means {@code void}.
 */
@Data
@NoArgsConstructor
public class FunctionNode {
    private String name;
    private TypeNode returnType;
    private List<FieldNode> arguments = new ArrayList<>();
    private List<FieldNode> exceptions = new ArrayList<>();
    private boolean oneWay;
    private int sourceLine;

    @Builder
    public FunctionNode(String name, TypeNode returnType, List<FieldNode> arguments,
                        List<FieldNode> exceptions, boolean oneWay, int sourceLine) {
        this.name = name;
        this.returnType = returnType;
        this.arguments = arguments != null ? arguments : new ArrayList<>();
        this.exceptions = exceptions != null ? exceptions : new ArrayList<>();
        this.oneWay = oneWay;
        this.sourceLine = sourceLine;
    }

    public boolean isVoid() {
        return returnType == null;
    }
}
