package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.UnresolvedReferenceException;

import lombok.NonNull;
import lombok.Value;

/**
 * A type referenced by name that has not been resolved yet.
 *
 * Linking replaces it with the spec registered under that name, so no
 * instance of this class survives in a linked graph.
 */
@Value
public class TypeReferenceSpec implements TypeSpec {
    @NonNull
    String name;
    int line;

    @Override
    public String getThriftName() {
        return name;
    }

    @Override
    public TypeSpec link(Scope scope) {
        TypeSpec target = scope.resolveType(name)
                .orElseThrow(() -> new UnresolvedReferenceException(name, line));
        return target.link(scope);
    }
}
