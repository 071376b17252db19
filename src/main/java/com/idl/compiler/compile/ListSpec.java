package com.idl.compiler.compile;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code list<T>}
 */
@Value
public class ListSpec implements TypeSpec {
    @NonNull
    TypeSpec valueSpec;

    @Override
    public String getThriftName() {
        return "list<" + valueSpec.getThriftName() + ">";
    }

    @Override
    public TypeSpec link(Scope scope) {
        TypeSpec linkedValue = valueSpec.link(scope);
        return linkedValue == valueSpec ? this : new ListSpec(linkedValue);
    }
}
