package com.idl.compiler.compile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Resolves the name references left in compiled specs against a {@link Scope}.
 */
public class Linker {
    private static final Logger log = LoggerFactory.getLogger(Linker.class);

    /**
     * Link one spec.
     *
     * @return the linked spec; the same instance unless {@code spec} is a bare reference or container
     * @throws com.idl.compiler.compile.exception.UnresolvedReferenceException if a name is missing from the scope
     */
    public Spec link(Spec spec, Scope scope) {
        log.debug("Linking {} \"{}\"", spec.getClass().getSimpleName(), spec.getThriftName());
        return spec.link(scope);
    }

    /**
     * Link specs in iteration order, stopping at the first failure.
     */
    public List<Spec> linkAll(Collection<? extends Spec> specs, Scope scope) {
        List<Spec> linked = new ArrayList<>(specs.size());
        for (Spec spec : specs) {
            linked.add(link(spec, scope));
        }
        log.debug("Linked {} specs", linked.size());
        return linked;
    }
}
