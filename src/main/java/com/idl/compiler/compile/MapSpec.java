package com.idl.compiler.compile;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code map<K, V>}
 */
@Value
public class MapSpec implements TypeSpec {
    @NonNull
    TypeSpec keySpec;
    @NonNull
    TypeSpec valueSpec;

    @Override
    public String getThriftName() {
        return "map<" + keySpec.getThriftName() + ", " + valueSpec.getThriftName() + ">";
    }

    @Override
    public TypeSpec link(Scope scope) {
        TypeSpec linkedKey = keySpec.link(scope);
        TypeSpec linkedValue = valueSpec.link(scope);
        if (linkedKey == keySpec && linkedValue == valueSpec) {
            return this;
        }
        return new MapSpec(linkedKey, linkedValue);
    }
}
