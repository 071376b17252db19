package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class ConstantList extends ConstantValue {
    private final List<ConstantValue> items;

    public ConstantList(List<ConstantValue> items, int sourceLine) {
        super(sourceLine);
        this.items = List.copyOf(items);
    }
}
