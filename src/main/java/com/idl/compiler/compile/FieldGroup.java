package com.idl.compiler.compile;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, name-unique collection of fields belonging to one struct body,
 * one argument list or one throws list.
 *
 * Instances are built by {@link FieldCompiler}, which enforces uniqueness.
 */
@ToString
@EqualsAndHashCode(doNotUseGetters = true)
public class FieldGroup {

    private final Map<String, FieldSpec> fields;

    FieldGroup(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static FieldGroup empty() {
        return new FieldGroup(Map.of());
    }

    /**
     * Build a group from already compiled fields, rejecting duplicate names.
     */
    public static FieldGroup of(FieldSpec... specs) {
        Map<String, FieldSpec> fields = new LinkedHashMap<>();
        for (FieldSpec spec : specs) {
            if (fields.putIfAbsent(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("duplicate field name: " + spec.getName());
            }
        }
        return new FieldGroup(fields);
    }

    public Optional<FieldSpec> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<FieldSpec> findById(int id) {
        return fields.values().stream()
                .filter(f -> f.getId() == id)
                .findFirst();
    }

    /**
     * Fields in declaration order.
     */
    public Collection<FieldSpec> getFields() {
        return fields.values();
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    void link(Scope scope) {
        for (FieldSpec field : fields.values()) {
            field.link(scope);
        }
    }
}
