package com.ddosshield.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Mitigation state of one source identity.
 *
 * <p>
 * Immutable snapshot. The state store holds exactly one per identity and the
 * state machine replaces it atomically through
 * {@code SourceStateStore#compareAndTransition}. {@link #getGeneration()}
 * increases on every lifecycle change so that timers armed for an earlier
 * state can recognise themselves as stale.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SourceIdentity identity;
    private final MitigationState state;
    private final int suspiciousStreak;
    private final int blockStreak;
    private final int cleanStreak;
    private final double lastScore;
    private final Instant lastSeenAt;
    private final Instant lastTransitionAt;
    private final Instant blockExpiresAt;
    private final Instant probationEndsAt;
    private final int relapseLevel;
    private final long generation;

    private SourceState(Builder b) {
        this.identity = Objects.requireNonNull(b.identity, "identity must not be null");
        this.state = Objects.requireNonNull(b.state, "state must not be null");
        this.suspiciousStreak = b.suspiciousStreak;
        this.blockStreak = b.blockStreak;
        this.cleanStreak = b.cleanStreak;
        this.lastScore = b.lastScore;
        this.lastSeenAt = Objects.requireNonNull(b.lastSeenAt, "lastSeenAt must not be null");
        this.lastTransitionAt = Objects.requireNonNull(b.lastTransitionAt, "lastTransitionAt must not be null");
        this.blockExpiresAt = b.blockExpiresAt;
        this.probationEndsAt = b.probationEndsAt;
        this.relapseLevel = b.relapseLevel;
        this.generation = b.generation;
    }

    /**
     * @param identity source identity
     * @param now      first sighting
     * @return default {@link MitigationState#OBSERVING} state
     */
    public static SourceState initial(SourceIdentity identity, Instant now) {
        return builder()
                .identity(identity)
                .state(MitigationState.OBSERVING)
                .lastSeenAt(now)
                .lastTransitionAt(now)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder pre-populated with this state's values
     */
    public Builder toBuilder() {
        return new Builder()
                .identity(identity)
                .state(state)
                .suspiciousStreak(suspiciousStreak)
                .blockStreak(blockStreak)
                .cleanStreak(cleanStreak)
                .lastScore(lastScore)
                .lastSeenAt(lastSeenAt)
                .lastTransitionAt(lastTransitionAt)
                .blockExpiresAt(blockExpiresAt)
                .probationEndsAt(probationEndsAt)
                .relapseLevel(relapseLevel)
                .generation(generation);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SourceIdentity getIdentity() {
        return identity;
    }

    public MitigationState getState() {
        return state;
    }

    /** Consecutive verdicts at or above the suspicious threshold. */
    public int getSuspiciousStreak() {
        return suspiciousStreak;
    }

    /** Consecutive verdicts at or above the block threshold. */
    public int getBlockStreak() {
        return blockStreak;
    }

    /** Consecutive verdicts below the suspicious threshold. */
    public int getCleanStreak() {
        return cleanStreak;
    }

    public double getLastScore() {
        return lastScore;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public Instant getLastTransitionAt() {
        return lastTransitionAt;
    }

    /** @return block expiry, or {@code null} unless {@link MitigationState#BLOCKED} */
    public Instant getBlockExpiresAt() {
        return blockExpiresAt;
    }

    /** @return probation end, or {@code null} unless {@link MitigationState#RECOVERING} */
    public Instant getProbationEndsAt() {
        return probationEndsAt;
    }

    /** Number of relapse blocks since the source last completed probation. */
    public int getRelapseLevel() {
        return relapseLevel;
    }

    public long getGeneration() {
        return generation;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private SourceIdentity identity;
        private MitigationState state = MitigationState.OBSERVING;
        private int suspiciousStreak;
        private int blockStreak;
        private int cleanStreak;
        private double lastScore;
        private Instant lastSeenAt;
        private Instant lastTransitionAt;
        private Instant blockExpiresAt;
        private Instant probationEndsAt;
        private int relapseLevel;
        private long generation;

        public Builder identity(SourceIdentity identity) {
            this.identity = identity;
            return this;
        }

        public Builder state(MitigationState state) {
            this.state = state;
            return this;
        }

        public Builder suspiciousStreak(int suspiciousStreak) {
            this.suspiciousStreak = suspiciousStreak;
            return this;
        }

        public Builder blockStreak(int blockStreak) {
            this.blockStreak = blockStreak;
            return this;
        }

        public Builder cleanStreak(int cleanStreak) {
            this.cleanStreak = cleanStreak;
            return this;
        }

        public Builder lastScore(double lastScore) {
            this.lastScore = lastScore;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Builder lastTransitionAt(Instant lastTransitionAt) {
            this.lastTransitionAt = lastTransitionAt;
            return this;
        }

        public Builder blockExpiresAt(Instant blockExpiresAt) {
            this.blockExpiresAt = blockExpiresAt;
            return this;
        }

        public Builder probationEndsAt(Instant probationEndsAt) {
            this.probationEndsAt = probationEndsAt;
            return this;
        }

        public Builder relapseLevel(int relapseLevel) {
            this.relapseLevel = relapseLevel;
            return this;
        }

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        /**
         * Move to {@code next}, stamping the transition time and bumping the
         * generation. Timed fields are cleared; callers set the ones the new
         * state needs.
         */
        public Builder transitionTo(MitigationState next, Instant at) {
            this.state = next;
            this.lastTransitionAt = at;
            this.blockExpiresAt = null;
            this.probationEndsAt = null;
            this.generation++;
            return this;
        }

        public SourceState build() {
            return new SourceState(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SourceState that))
            return false;
        return generation == that.generation
                && suspiciousStreak == that.suspiciousStreak
                && blockStreak == that.blockStreak
                && cleanStreak == that.cleanStreak
                && relapseLevel == that.relapseLevel
                && Double.compare(lastScore, that.lastScore) == 0
                && identity.equals(that.identity)
                && state == that.state
                && lastSeenAt.equals(that.lastSeenAt)
                && Objects.equals(blockExpiresAt, that.blockExpiresAt)
                && Objects.equals(probationEndsAt, that.probationEndsAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, state, generation, lastSeenAt);
    }

    @Override
    public String toString() {
        return "SourceState{" +
                identity +
                " " + state +
                " gen=" + generation +
                ", suspicious=" + suspiciousStreak +
                ", block=" + blockStreak +
                ", clean=" + cleanStreak +
                ", lastScore=" + String.format("%.3f", lastScore) +
                (blockExpiresAt != null ? ", blockExpiresAt=" + blockExpiresAt : "") +
                (probationEndsAt != null ? ", probationEndsAt=" + probationEndsAt : "") +
                (relapseLevel > 0 ? ", relapse=" + relapseLevel : "") +
                '}';
    }
}
