package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.CyclicReferenceException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * {@code typedef <target> <name>}. The target is a reference until linked.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false, onlyExplicitlyIncluded = true)
public class TypedefSpec extends LinkableSpec implements TypeSpec {

    @NonNull
    @EqualsAndHashCode.Include
    private final String name;

    @NonNull
    @ToString.Exclude
    private TypeSpec target;

    public TypedefSpec(@NonNull String name, @NonNull TypeSpec target) {
        this.name = name;
        this.target = target;
    }

    @Override
    public String getThriftName() {
        return name;
    }

    @EqualsAndHashCode.Include
    @ToString.Include(name = "target")
    String targetName() {
        return target.getThriftName();
    }

    @Override
    public TypedefSpec link(Scope scope) {
        linkOnce(scope);
        return this;
    }

    @Override
    protected void doLink(Scope scope) {
        checkTargetCycle(scope);
        target = target.link(scope);
    }

    /**
     * Follows the chain of typedef targets, resolving names still pending,
     * and fails if it leads back to this typedef.
     */
    private void checkTargetCycle(Scope scope) {
        List<String> chain = new ArrayList<>();
        chain.add(name);
        Set<TypeSpec> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        TypeSpec current = target;
        while (current != null && visited.add(current)) {
            if (current instanceof TypeReferenceSpec reference) {
                current = scope.resolveType(reference.getName()).orElse(null);
            } else if (current instanceof TypedefSpec typedef) {
                chain.add(typedef.name);
                if (typedef == this) {
                    throw new CyclicReferenceException(chain);
                }
                current = typedef.target;
            } else {
                return;
            }
        }
    }
}
