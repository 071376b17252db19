package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A field of a struct body, an argument list or a throws list.
 */
@Data
@NoArgsConstructor
public class FieldNode {
    /** Null when the source omits the id. */
    private Integer id;
    private String name;
    private Requiredness requiredness = Requiredness.UNSPECIFIED;
    private TypeNode type;
    private ConstantValue defaultValue;
    private int sourceLine;

    @Builder
    public FieldNode(Integer id, String name, Requiredness requiredness, TypeNode type,
                     ConstantValue defaultValue, int sourceLine) {
        this.id = id;
        this.name = name;
        this.requiredness = requiredness != null ? requiredness : Requiredness.UNSPECIFIED;
        this.type = type;
        this.defaultValue = defaultValue;
        this.sourceLine = sourceLine;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
