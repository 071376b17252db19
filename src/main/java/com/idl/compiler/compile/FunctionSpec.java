package com.idl.compiler.compile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A compiled service function.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FunctionSpec implements Spec {

    @NonNull
    private final String name;

    @NonNull
    private final FieldGroup argsSpec;

    /**
     * Null when the function returns {@code void} and declares no exceptions.
     */
    private final ResultSpec resultSpec;

    private final boolean oneWay;

    public FunctionSpec(@NonNull String name, @NonNull FieldGroup argsSpec, ResultSpec resultSpec, boolean oneWay) {
        this.name = name;
        this.argsSpec = argsSpec;
        this.resultSpec = resultSpec;
        this.oneWay = oneWay;
    }

    public FunctionSpec(@NonNull String name, @NonNull FieldGroup argsSpec, ResultSpec resultSpec) {
        this(name, argsSpec, resultSpec, false);
    }

    @Override
    public String getThriftName() {
        return name;
    }

    @Override
    public FunctionSpec link(Scope scope) {
        argsSpec.link(scope);
        if (resultSpec != null) {
            resultSpec.link(scope);
        }
        return this;
    }
}
