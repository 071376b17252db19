package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.CyclicReferenceException;
import com.idl.compiler.compile.exception.UnresolvedReferenceException;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A compiled service.
 *
 * The parent is held as a pending name until linked, then as the exact
 * {@link ServiceSpec} instance found in scope. Inherited functions are never
 * copied into {@link #getFunctions()}; consumers walk {@link #getParent()}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false, onlyExplicitlyIncluded = true)
public class ServiceSpec extends LinkableSpec implements Spec {

    @NonNull
    @EqualsAndHashCode.Include
    private final String name;

    @ToString.Exclude
    private ServiceSpec parent;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private PendingParent pendingParent;

    @NonNull
    @EqualsAndHashCode.Include
    private final Map<String, FunctionSpec> functions;

    public ServiceSpec(@NonNull String name, ServiceSpec parent, @NonNull Map<String, FunctionSpec> functions) {
        this.name = name;
        this.parent = parent;
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    ServiceSpec(String name, String parentName, int parentLine, Map<String, FunctionSpec> functions) {
        this(name, (ServiceSpec) null, functions);
        if (parentName != null) {
            this.pendingParent = new PendingParent(parentName, parentLine);
        }
    }

    @Override
    public String getThriftName() {
        return name;
    }

    public Optional<ServiceSpec> getParentSpec() {
        return Optional.ofNullable(parent);
    }

    /**
     * Name of the parent, whether or not it has been resolved yet.
     */
    @EqualsAndHashCode.Include
    @ToString.Include(name = "parent")
    public String getParentName() {
        if (parent != null) {
            return parent.getName();
        }
        return pendingParent != null ? pendingParent.name : null;
    }

    @Override
    public ServiceSpec link(Scope scope) {
        linkOnce(scope);
        return this;
    }

    @Override
    protected void doLink(Scope scope) {
        if (pendingParent != null) {
            PendingParent pending = pendingParent;
            ServiceSpec resolved = scope.resolveService(pending.name)
                    .orElseThrow(() -> new UnresolvedReferenceException(pending.name, pending.line));
            checkInheritanceCycle(resolved, scope);
            parent = resolved.link(scope);
            pendingParent = null;
        }

        for (FunctionSpec function : functions.values()) {
            function.link(scope);
        }
    }

    /**
     * Walks the parent chain starting at {@code resolved}, following parents that
     * are still pending by name, and fails if it leads back to this service.
     */
    private void checkInheritanceCycle(ServiceSpec resolved, Scope scope) {
        List<String> chain = new ArrayList<>();
        chain.add(name);
        Set<ServiceSpec> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        ServiceSpec current = resolved;
        while (current != null && visited.add(current)) {
            chain.add(current.name);
            if (current == this) {
                throw new CyclicReferenceException(chain);
            }
            current = current.nextParent(scope);
        }
    }

    private ServiceSpec nextParent(Scope scope) {
        if (parent != null) {
            return parent;
        }
        return pendingParent != null ? scope.resolveService(pendingParent.name).orElse(null) : null;
    }

    private static final class PendingParent {
        private final String name;
        private final int line;

        private PendingParent(String name, int line) {
            this.name = name;
            this.line = line;
        }
    }
}
