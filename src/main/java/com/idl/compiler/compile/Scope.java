package com.idl.compiler.compile;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Name to spec lookup used while linking.
 *
 * Types, services and constants are looked up separately. A name of the form
 * {@code prefix.Name} is first tried against the scope included as {@code prefix}.
 */
public interface Scope {

    Optional<TypeSpec> lookupType(String name);

    Optional<ServiceSpec> lookupService(String name);

    Optional<ConstantSpec> lookupConstant(String name);

    Optional<Scope> lookupInclude(String name);

    default Optional<TypeSpec> resolveType(String name) {
        return resolve(name, Scope::lookupType);
    }

    default Optional<ServiceSpec> resolveService(String name) {
        return resolve(name, Scope::lookupService);
    }

    default Optional<ConstantSpec> resolveConstant(String name) {
        return resolve(name, Scope::lookupConstant);
    }

    private <T> Optional<T> resolve(String name, BiFunction<Scope, String, Optional<T>> lookup) {
        int dot = name.indexOf('.');
        if (dot > 0) {
            Optional<Scope> include = lookupInclude(name.substring(0, dot));
            if (include.isPresent()) {
                return lookup.apply(include.get(), name.substring(dot + 1));
            }
        }
        return lookup.apply(this, name);
    }

    /**
     * A scope that resolves nothing.
     */
    static Scope empty() {
        return Registry.EMPTY;
    }
}
