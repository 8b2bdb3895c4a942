package com.gridcast.core.capability;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-invocation handle shared between the dispatcher and a running capability.
 * <p>
 * A capability with side effects must call {@link #tryCommit()} immediately before
 * making them durable and skip them when it returns {@code false}. The dispatcher
 * {@link #abandon() abandons} an invocation on timeout; once abandoned, commit is refused.
 */
public final class InvocationContext {

    public enum State { ACTIVE, COMMITTED, ABANDONED }

    private final String sessionId;
    private final String invocationId;
    private final String capabilityName;
    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);

    public InvocationContext(String sessionId, String invocationId, String capabilityName) {
        this.sessionId = sessionId;
        this.invocationId = invocationId;
        this.capabilityName = capabilityName;
    }

    /**
     * @return true if the invocation is (now) committed, false if it was abandoned
     */
    public boolean tryCommit() {
        return state.compareAndSet(State.ACTIVE, State.COMMITTED) || state.get() == State.COMMITTED;
    }

    /**
     * @return true if the invocation was abandoned before committing any side effect
     */
    public boolean abandon() {
        return state.compareAndSet(State.ACTIVE, State.ABANDONED) || state.get() == State.ABANDONED;
    }

    public boolean isAbandoned() {
        return state.get() == State.ABANDONED;
    }

    public State state() {
        return state.get();
    }

    public String sessionId() {
        return sessionId;
    }

    public String invocationId() {
        return invocationId;
    }

    public String capabilityName() {
        return capabilityName;
    }
}
