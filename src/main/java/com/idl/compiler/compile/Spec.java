package com.idl.compiler.compile;

/**
 * A compiled, semantically validated IDL entity.
 *
 * A spec is produced unlinked by the {@link Compiler} and becomes read-only once
 * {@link #link(Scope)} succeeds.
 */
public interface Spec {

    /**
     * Name of this entity as written in the IDL.
     */
    String getThriftName();

    /**
     * Resolve every name reference held by this spec and the specs reachable from it.
     * Repeated calls on a linked spec are no-ops.
     *
     * @return the linked spec, which is {@code this} for everything except
     *         references and containers
     */
    Spec link(Scope scope);
}
