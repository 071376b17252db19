package com.idl.compiler.compile;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@link Scope} assembled once per compilation unit, after every
 * definition of the unit has been compiled.
 */
public final class Registry implements Scope {

    static final Registry EMPTY = builder().build();

    private final Map<String, TypeSpec> types;
    private final Map<String, ServiceSpec> services;
    private final Map<String, ConstantSpec> constants;
    private final Map<String, Scope> includes;

    private Registry(Builder builder) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(builder.types));
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(builder.services));
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constants));
        this.includes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.includes));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<TypeSpec> lookupType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    @Override
    public Optional<ServiceSpec> lookupService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    @Override
    public Optional<ConstantSpec> lookupConstant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    @Override
    public Optional<Scope> lookupInclude(String name) {
        return Optional.ofNullable(includes.get(name));
    }

    public Collection<TypeSpec> getTypes() {
        return types.values();
    }

    public Collection<ServiceSpec> getServices() {
        return services.values();
    }

    public Collection<ConstantSpec> getConstants() {
        return constants.values();
    }

    public Set<String> getIncludeNames() {
        return includes.keySet();
    }

    public boolean isEmpty() {
        return types.isEmpty() && services.isEmpty() && constants.isEmpty() && includes.isEmpty();
    }

    public static final class Builder {
        private final Map<String, TypeSpec> types = new LinkedHashMap<>();
        private final Map<String, ServiceSpec> services = new LinkedHashMap<>();
        private final Map<String, ConstantSpec> constants = new LinkedHashMap<>();
        private final Map<String, Scope> includes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder type(TypeSpec spec) {
            return type(spec.getThriftName(), spec);
        }

        public Builder type(String name, TypeSpec spec) {
            put(types, name, spec);
            return this;
        }

        public Builder service(ServiceSpec spec) {
            put(services, spec.getName(), spec);
            return this;
        }

        public Builder constant(ConstantSpec spec) {
            put(constants, spec.getName(), spec);
            return this;
        }

        public Builder include(String name, Scope scope) {
            put(includes, name, scope);
            return this;
        }

        /**
         * Register a top-level spec under the table matching its kind.
         */
        public Builder add(Spec spec) {
            if (spec instanceof ServiceSpec service) {
                return service(service);
            }
            if (spec instanceof ConstantSpec constant) {
                return constant(constant);
            }
            if (spec instanceof TypeSpec type) {
                return type(type);
            }
            throw new IllegalArgumentException("cannot register " + spec.getClass().getSimpleName()
                    + " \"" + spec.getThriftName() + "\" at the top level");
        }

        public Registry build() {
            return new Registry(this);
        }

        private static <T> void put(Map<String, T> table, String name, T value) {
            if (table.putIfAbsent(name, value) != null) {
                throw new IllegalArgumentException("\"" + name + "\" is already registered");
            }
        }
    }
}
