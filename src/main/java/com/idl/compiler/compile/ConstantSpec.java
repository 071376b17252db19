package com.idl.compiler.compile;

import com.idl.compiler.model.ConstantValue;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * {@code const <type> <name> = <value>}. Only the type is linked; the value is kept as written.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false, onlyExplicitlyIncluded = true)
public class ConstantSpec extends LinkableSpec implements Spec {

    @NonNull
    @EqualsAndHashCode.Include
    private final String name;

    @NonNull
    @ToString.Exclude
    private TypeSpec type;

    @NonNull
    @EqualsAndHashCode.Include
    private final ConstantValue value;

    public ConstantSpec(@NonNull String name, @NonNull TypeSpec type, @NonNull ConstantValue value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }

    @Override
    public String getThriftName() {
        return name;
    }

    @EqualsAndHashCode.Include
    String typeName() {
        return type.getThriftName();
    }

    @Override
    public ConstantSpec link(Scope scope) {
        linkOnce(scope);
        return this;
    }

    @Override
    protected void doLink(Scope scope) {
        type = type.link(scope);
    }
}
