package com.idl.compiler.compile;

/**
 * Base class for named specs that are shared by reference and linked exactly once.
 */
public abstract class LinkableSpec {

    private SpecState state = SpecState.COMPILED;

    public SpecState getState() {
        return state;
    }

    public boolean isLinked() {
        return state == SpecState.LINKED;
    }

    /**
     * Runs {@link #doLink(Scope)} unless this spec is already linked or being linked.
     * Callers must not link the same spec from two threads at once.
     *
     * When the outermost call fails, every spec that finished linking during it
     * is marked failed as well, since it may point at a spec that did not link.
     */
    protected final void linkOnce(Scope scope) {
        switch (state) {
            case LINKED, LINKING -> {
                return;
            }
            case FAILED -> throw new IllegalStateException(
                    "\"" + getThriftName() + "\" failed to link earlier and cannot be used");
            default -> {
            }
        }

        boolean outermost = !(scope instanceof LinkSession);
        LinkSession session = outermost ? new LinkSession(scope) : (LinkSession) scope;

        state = SpecState.LINKING;
        try {
            doLink(session);
            state = SpecState.LINKED;
            session.completed(this);
        } catch (RuntimeException e) {
            state = SpecState.FAILED;
            if (outermost) {
                session.failCompleted();
            }
            throw e;
        }
    }

    void markFailed() {
        state = SpecState.FAILED;
    }

    public abstract String getThriftName();

    protected abstract void doLink(Scope scope);
}
