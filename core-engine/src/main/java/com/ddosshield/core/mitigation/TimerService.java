package com.ddosshield.core.mitigation;

import com.ddosshield.core.model.SourceIdentity;

import java.time.Instant;

/**
 * Schedules the time-based transitions of a source (block expiry, end of
 * probation).
 *
 * <p>
 * At most one timer exists per identity. Each timer carries the
 * {@link com.ddosshield.core.model.SourceState#getGeneration() generation}
 * of the state that armed it, so a timer that fires after the state has
 * moved on is recognised as stale and ignored.
 * </p>
 *
 * @since 1.0.0
 */
public interface TimerService {

    /**
     * Arm (or re-arm) the identity's timer. A request carrying an older
     * generation than the armed timer is ignored.
     *
     * @param identity   source identity
     * @param generation state generation the timer belongs to
     * @param dueAt      when to fire
     */
    void schedule(SourceIdentity identity, long generation, Instant dueAt);

    /**
     * Cancel the identity's timer. Safe to call repeatedly and for
     * identities without a timer.
     *
     * @param identity source identity
     */
    void cancel(SourceIdentity identity);

    /** Timer service that never fires; time-based transitions then happen lazily. */
    TimerService NO_OP = new TimerService() {
        @Override
        public void schedule(SourceIdentity identity, long generation, Instant dueAt) {
        }

        @Override
        public void cancel(SourceIdentity identity) {
        }
    };
}
