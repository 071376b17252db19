package com.idl.compiler.compile;

import lombok.NonNull;
import lombok.Value;

@Value
public class EnumItemSpec {
    @NonNull
    String name;
    int value;
}
