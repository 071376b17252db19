package com.idl.compiler.compile;

import com.idl.compiler.model.BaseType;

/**
 * Primitive types. Always linked.
 */
public enum BaseTypeSpec implements TypeSpec {
    BOOL("bool"),
    BYTE("byte"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    DOUBLE("double"),
    STRING("string"),
    BINARY("binary");

    private final String thriftName;

    BaseTypeSpec(String thriftName) {
        this.thriftName = thriftName;
    }

    @Override
    public String getThriftName() {
        return thriftName;
    }

    @Override
    public TypeSpec link(Scope scope) {
        return this;
    }

    /**
     * {@code i8} is an alias of {@code byte}.
     */
    public static BaseTypeSpec of(BaseType baseType) {
        return switch (baseType) {
            case BOOL -> BOOL;
            case BYTE, I8 -> BYTE;
            case I16 -> I16;
            case I32 -> I32;
            case I64 -> I64;
            case DOUBLE -> DOUBLE;
            case STRING -> STRING;
            case BINARY -> BINARY;
        };
    }
}
