package com.idl.compiler.compile;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The linked result of compiling one IDL file.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class Module {

    @ToString.Include
    private final String name;

    private final String sourceFile;

    private final Registry scope;

    /** Top-level specs in declaration order, keyed by name. */
    private final Map<String, Spec> specs;

    private final Map<String, Module> includes;

    public Module(@NonNull String name, String sourceFile, @NonNull Registry scope,
                  @NonNull Map<String, Spec> specs, @NonNull Map<String, Module> includes) {
        this.name = name;
        this.sourceFile = sourceFile;
        this.scope = scope;
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
        this.includes = Collections.unmodifiableMap(new LinkedHashMap<>(includes));
    }

    public Optional<TypeSpec> findType(String typeName) {
        return scope.resolveType(typeName);
    }

    public Optional<ServiceSpec> findService(String serviceName) {
        return scope.resolveService(serviceName);
    }

    public Optional<ConstantSpec> findConstant(String constantName) {
        return scope.resolveConstant(constantName);
    }
}
