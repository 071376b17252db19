package com.idl.compiler.compile;

import com.idl.compiler.model.ConstantValue;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A compiled field of a struct body, an argument list or a throws list.
 *
 * Equality compares the type by its Thrift name so that self-referencing
 * structs compare without recursing.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FieldSpec implements Spec {

    @EqualsAndHashCode.Include
    private final int id;

    @NonNull
    @EqualsAndHashCode.Include
    private final String name;

    @NonNull
    @ToString.Exclude
    private TypeSpec type;

    @EqualsAndHashCode.Include
    private final boolean required;

    /**
     * Raw default value as written; never evaluated.
     */
    @EqualsAndHashCode.Include
    private final ConstantValue defaultValue;

    @Builder
    public FieldSpec(int id, @NonNull String name, @NonNull TypeSpec type, boolean required,
                     ConstantValue defaultValue) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.required = required;
        this.defaultValue = defaultValue;
    }

    @Override
    public String getThriftName() {
        return name;
    }

    @EqualsAndHashCode.Include
    @ToString.Include(name = "type")
    String typeName() {
        return type.getThriftName();
    }

    @Override
    public FieldSpec link(Scope scope) {
        type = type.link(scope);
        return this;
    }
}
