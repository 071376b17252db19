package com.idl.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Primitive types of the IDL.
 */
public enum BaseType {
    BOOL("bool"),
    BYTE("byte"),
    I8("i8"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    DOUBLE("double"),
    STRING("string"),
    BINARY("binary");

    private final String keyword;

    BaseType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<BaseType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(t -> t.keyword.equals(keyword))
                .findFirst();
    }
}
