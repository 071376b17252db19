package com.idl.compiler.compile;

import com.idl.compiler.model.StructKind;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A compiled struct, union or exception.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class StructSpec extends LinkableSpec implements TypeSpec {

    @NonNull
    private final String name;

    @NonNull
    private final StructKind kind;

    @NonNull
    @ToString.Exclude
    private final FieldGroup fields;

    public StructSpec(@NonNull String name, @NonNull StructKind kind, @NonNull FieldGroup fields) {
        this.name = name;
        this.kind = kind;
        this.fields = fields;
    }

    @Override
    public String getThriftName() {
        return name;
    }

    public boolean isException() {
        return kind == StructKind.EXCEPTION;
    }

    public boolean isUnion() {
        return kind == StructKind.UNION;
    }

    @Override
    public StructSpec link(Scope scope) {
        linkOnce(scope);
        return this;
    }

    @Override
    protected void doLink(Scope scope) {
        fields.link(scope);
    }
}
