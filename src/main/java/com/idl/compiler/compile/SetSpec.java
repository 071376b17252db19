package com.idl.compiler.compile;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code set<T>}
 */
@Value
public class SetSpec implements TypeSpec {
    @NonNull
    TypeSpec valueSpec;

    @Override
    public String getThriftName() {
        return "set<" + valueSpec.getThriftName() + ">";
    }

    @Override
    public TypeSpec link(Scope scope) {
        TypeSpec linkedValue = valueSpec.link(scope);
        return linkedValue == valueSpec ? this : new SetSpec(linkedValue);
    }
}
