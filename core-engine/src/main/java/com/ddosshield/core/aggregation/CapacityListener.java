package com.ddosshield.core.aggregation;

import com.ddosshield.core.model.SourceIdentity;

/**
 * Callback raised when a bounded per-identity table is full and evicts an
 * entry to make room.
 *
 * <p>
 * Shared by the feature aggregator and the state store. Invoked while the
 * owning shard is locked, so implementations must be fast and must not call
 * back into the component that raised the event.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CapacityListener {

    /**
     * @param component short name of the evicting component
     * @param evicted   identity that was dropped
     * @param capacity  configured capacity that was exceeded
     */
    void onCapacityExceeded(String component, SourceIdentity evicted, int capacity);

    /** Listener that ignores every event. */
    CapacityListener NONE = (component, evicted, capacity) -> {
    };
}
