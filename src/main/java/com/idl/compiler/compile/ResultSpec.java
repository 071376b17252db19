package com.idl.compiler.compile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * What a function produces: an optional return type plus the exceptions it may throw.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ResultSpec implements Spec {

    /**
     * Null for {@code void}.
     */
    @ToString.Exclude
    private TypeSpec returnType;

    @NonNull
    @EqualsAndHashCode.Include
    private final FieldGroup exceptions;

    public ResultSpec(TypeSpec returnType, @NonNull FieldGroup exceptions) {
        this.returnType = returnType;
        this.exceptions = exceptions;
    }

    @Override
    public String getThriftName() {
        return returnType != null ? returnType.getThriftName() : "void";
    }

    @EqualsAndHashCode.Include
    @ToString.Include(name = "returnType")
    String returnTypeName() {
        return returnType != null ? returnType.getThriftName() : null;
    }

    @Override
    public ResultSpec link(Scope scope) {
        if (returnType != null) {
            returnType = returnType.link(scope);
        }
        exceptions.link(scope);
        return this;
    }
}
