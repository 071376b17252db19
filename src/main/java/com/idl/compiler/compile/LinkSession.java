package com.idl.compiler.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scope handed down while one top-level {@link LinkableSpec#linkOnce(Scope)} call runs.
 *
 * Records every spec that finished linking inside that call, so that all of
 * them can be marked failed when the outermost spec fails.
 */
final class LinkSession implements Scope {

    private final Scope delegate;
    private final List<LinkableSpec> completed = new ArrayList<>();

    LinkSession(Scope delegate) {
        this.delegate = delegate;
    }

    void completed(LinkableSpec spec) {
        completed.add(spec);
    }

    void failCompleted() {
        for (LinkableSpec spec : completed) {
            spec.markFailed();
        }
        completed.clear();
    }

    @Override
    public Optional<TypeSpec> lookupType(String name) {
        return delegate.lookupType(name);
    }

    @Override
    public Optional<ServiceSpec> lookupService(String name) {
        return delegate.lookupService(name);
    }

    @Override
    public Optional<ConstantSpec> lookupConstant(String name) {
        return delegate.lookupConstant(name);
    }

    @Override
    public Optional<Scope> lookupInclude(String name) {
        return delegate.lookupInclude(name);
    }

    @Override
    public Optional<TypeSpec> resolveType(String name) {
        return delegate.resolveType(name);
    }

    @Override
    public Optional<ServiceSpec> resolveService(String name) {
        return delegate.resolveService(name);
    }

    @Override
    public Optional<ConstantSpec> resolveConstant(String name) {
        return delegate.resolveConstant(name);
    }
}
