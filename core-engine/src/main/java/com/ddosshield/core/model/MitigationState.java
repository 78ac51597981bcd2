package com.ddosshield.core.model;

/**
 * Lifecycle state of a single source identity.
 */
public enum MitigationState {

    /** Default for unseen or idle-reset sources. Traffic allowed. */
    OBSERVING(true),

    /** Elevated score observed, counting toward a block. Traffic allowed. */
    SUSPICIOUS(true),

    /** Block issued to the enforcement point until the block expires. */
    BLOCKED(false),

    /** Post-block probation. Traffic allowed, relapse re-blocks at once. */
    RECOVERING(true);

    private final boolean allowsTraffic;

    MitigationState(boolean allowsTraffic) {
        this.allowsTraffic = allowsTraffic;
    }

    public boolean allowsTraffic() {
        return allowsTraffic;
    }

    /**
     * States with a pending timer are never evicted for idleness or capacity,
     * otherwise the enforcement point would keep a block nobody lifts.
     *
     * @return {@code true} for {@link #BLOCKED} and {@link #RECOVERING}
     */
    public boolean isTimed() {
        return this == BLOCKED || this == RECOVERING;
    }
}
