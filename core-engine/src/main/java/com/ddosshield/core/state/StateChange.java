package com.ddosshield.core.state;

import com.ddosshield.core.model.SourceState;

import java.util.Objects;

/**
 * Result of an atomic read-modify-write on the state store.
 *
 * @since 1.0.0
 */
public final class StateChange {

    private final SourceState previous;
    private final SourceState current;

    public StateChange(SourceState previous, SourceState current) {
        this.previous = Objects.requireNonNull(previous, "previous must not be null");
        this.current = Objects.requireNonNull(current, "current must not be null");
    }

    /** State before the operation; a fresh initial state for new entries. */
    public SourceState previous() {
        return previous;
    }

    public SourceState current() {
        return current;
    }

    /**
     * @return {@code true} if the lifecycle state differs
     */
    public boolean isTransition() {
        return previous.getState() != current.getState();
    }

    @Override
    public String toString() {
        return "StateChange{" + previous.getState() + " -> " + current.getState()
                + ", identity=" + current.getIdentity() + '}';
    }
}
