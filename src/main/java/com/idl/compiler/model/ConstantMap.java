package com.idl.compiler.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class ConstantMap extends ConstantValue {
    private final List<Entry> entries;

    public ConstantMap(List<Entry> entries, int sourceLine) {
        super(sourceLine);
        this.entries = List.copyOf(entries);
    }

    @Value
    public static class Entry {
        ConstantValue key;
        ConstantValue value;
    }
}
