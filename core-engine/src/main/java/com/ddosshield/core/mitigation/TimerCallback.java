package com.ddosshield.core.mitigation;

import com.ddosshield.core.model.SourceIdentity;

import java.time.Instant;

/**
 * Receives fired timers.
 */
@FunctionalInterface
public interface TimerCallback {

    /**
     * @param identity   identity whose timer fired
     * @param generation generation the timer was armed for
     * @param firedAt    current time
     */
    void onTimer(SourceIdentity identity, long generation, Instant firedAt);
}
