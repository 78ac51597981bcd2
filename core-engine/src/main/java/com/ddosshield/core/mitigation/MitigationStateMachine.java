package com.ddosshield.core.mitigation;

import com.ddosshield.core.config.MitigationSettings;
import com.ddosshield.core.explain.AttackClassifier;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.ActionKind;
import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.AttackType;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.MitigationState;
import com.ddosshield.core.model.Severity;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.SourceState;
import com.ddosshield.core.state.SourceStateStore;
import com.ddosshield.core.state.StateChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-source hysteresis state machine.
 *
 * <h3>States and transitions</h3>
 * <pre>
 * OBSERVING  --score &gt;= suspicious--------------------------&gt; SUSPICIOUS  (watch, alert)
 * SUSPICIOUS --score &gt;= block for N consecutive verdicts------&gt; BLOCKED     (block, high alert)
 * SUSPICIOUS --score &lt; suspicious for M consecutive verdicts--&gt; OBSERVING
 * BLOCKED    --block duration elapsed------------------------&gt; RECOVERING  (unblock)
 * RECOVERING --score &gt;= suspicious within probation----------&gt; BLOCKED     (block, critical alert)
 * RECOVERING --probation elapsed-----------------------------&gt; OBSERVING
 * </pre>
 *
 * <p>
 * The verdict that enters SUSPICIOUS already counts towards the block
 * streak, so with {@code N = 1} a single verdict at or above the block
 * threshold passes through SUSPICIOUS to BLOCKED in one step. A relapse
 * block lasts {@code blockDuration * backoffMultiplier^relapses}, capped.
 * </p>
 *
 * <h3>Time</h3>
 * <p>
 * All decisions use event time: a verdict's time is its window end. Block
 * expiry and probation end are driven by the {@link TimerService} and are
 * also applied lazily before each verdict, so a verdict arriving after an
 * expiry sees the expired state even if the timer has not fired yet.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * Every transition is one {@link SourceStateStore} read-modify-write. The
 * resulting action and alert are derived from the state before and after,
 * so each transition emits at most one of each. Timers are armed and
 * cancelled after the store lock is released.
 * </p>
 *
 * @since 1.0.0
 */
public class MitigationStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(MitigationStateMachine.class);

    private final MitigationSettings settings;
    private final SourceStateStore store;
    private final TimerService timers;
    private final ShieldMetrics metrics;

    public MitigationStateMachine(MitigationSettings settings, SourceStateStore store, TimerService timers,
            ShieldMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Apply one fused verdict to its source.
     *
     * @param verdict fused verdict
     * @return the transitions caused, oldest first; empty if the state did not
     *         change
     */
    public List<TransitionOutcome> onVerdict(FusedVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        SourceIdentity identity = verdict.getIdentity();
        Instant now = verdict.getTimestamp();

        List<TransitionOutcome> outcomes = new ArrayList<>(advance(identity, now));
        StateChange change = store.compareAndTransition(identity, now, s -> applyVerdict(s, verdict, now));
        describe(change, verdict, now, false).ifPresent(outcomes::add);
        return outcomes;
    }

    /**
     * Handle a fired timer. Stale timers, armed for a generation the state
     * has since left, do nothing.
     */
    public List<TransitionOutcome> onTimer(SourceIdentity identity, long generation, Instant now) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Optional<StateChange> change = store.compareAndTransition(identity, generation, s -> expire(s, now));
        if (change.isEmpty()) {
            LOG.trace("Ignoring stale timer for {} gen {}", identity, generation);
            return List.of();
        }
        return describe(change.get(), null, now, false).map(List::of).orElse(List.of());
    }

    /**
     * Apply any block expiry or probation end that is due at {@code now}.
     * Untracked identities are left untracked.
     */
    public List<TransitionOutcome> advance(SourceIdentity identity, Instant now) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(now, "now must not be null");
        return store.transitionIfPresent(identity, s -> expire(s, now))
                .flatMap(change -> describe(change, null, now, false))
                .map(List::of)
                .orElse(List.of());
    }

    /**
     * Operator override: lift an active block immediately. The source enters
     * probation as if its block had expired.
     *
     * @param identity blocked source
     * @param now      current time
     * @param operator who requested the unblock, recorded in the action reason
     * @return the transition, or empty if the source was not blocked
     */
    public Optional<TransitionOutcome> manualUnblock(SourceIdentity identity, Instant now, String operator) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Optional<StateChange> change = store.transitionIfPresent(identity, s -> s.getState() == MitigationState.BLOCKED
                ? s.toBuilder()
                        .transitionTo(MitigationState.RECOVERING, now)
                        .probationEndsAt(now.plus(settings.probation()))
                        .build()
                : s);
        Optional<TransitionOutcome> outcome = change.flatMap(c -> describe(c, null, now, true));
        outcome.ifPresent(o -> LOG.info("Source {} manually unblocked by {}", identity,
                operator != null ? operator : "operator"));
        return outcome;
    }

    /**
     * Drop sources that produced no verdict within the idle timeout. Blocked
     * and recovering sources are kept until their timers run out.
     *
     * @param now current time
     * @return evicted identities
     */
    public List<SourceIdentity> evictIdle(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<SourceIdentity> evicted = store.evictIdle(now.minus(settings.idleTimeout())).stream()
                .map(SourceState::getIdentity)
                .toList();
        evicted.forEach(timers::cancel);
        return evicted;
    }

    public MitigationSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Transition rules (pure, run under the store lock)
    // ---------------------------------------------------------------

    SourceState applyVerdict(SourceState s, FusedVerdict verdict, Instant now) {
        double score = verdict.getScore();
        boolean suspicious = score >= settings.getSuspiciousThreshold();
        boolean blockable = score >= settings.getBlockThreshold();

        SourceState.Builder b = s.toBuilder()
                .lastScore(score)
                .lastSeenAt(now.isAfter(s.getLastSeenAt()) ? now : s.getLastSeenAt());

        return switch (s.getState()) {
            case OBSERVING -> {
                if (!suspicious) {
                    yield b.suspiciousStreak(0).blockStreak(0).cleanStreak(s.getCleanStreak() + 1).build();
                }
                b.transitionTo(MitigationState.SUSPICIOUS, now)
                        .suspiciousStreak(1)
                        .blockStreak(blockable ? 1 : 0)
                        .cleanStreak(0);
                yield blockable && settings.getBlockConfirmations() <= 1
                        ? block(b, now, 0).build()
                        : b.build();
            }
            case SUSPICIOUS -> {
                if (blockable) {
                    int streak = s.getBlockStreak() + 1;
                    b.blockStreak(streak).suspiciousStreak(s.getSuspiciousStreak() + 1).cleanStreak(0);
                    yield streak >= settings.getBlockConfirmations() ? block(b, now, 0).build() : b.build();
                }
                if (suspicious) {
                    yield b.blockStreak(0).suspiciousStreak(s.getSuspiciousStreak() + 1).cleanStreak(0).build();
                }
                int clean = s.getCleanStreak() + 1;
                b.blockStreak(0).cleanStreak(clean);
                yield clean >= settings.getClearConfirmations()
                        ? b.transitionTo(MitigationState.OBSERVING, now)
                                .suspiciousStreak(0).cleanStreak(0).build()
                        : b.build();
            }
            case BLOCKED -> b.build();
            case RECOVERING -> suspicious
                    ? block(b, now, s.getRelapseLevel() + 1).build()
                    : b.cleanStreak(s.getCleanStreak() + 1).build();
        };
    }

    SourceState expire(SourceState s, Instant now) {
        SourceState current = s;
        if (current.getState() == MitigationState.BLOCKED
                && current.getBlockExpiresAt() != null
                && !now.isBefore(current.getBlockExpiresAt())) {
            Instant expiredAt = current.getBlockExpiresAt();
            current = current.toBuilder()
                    .transitionTo(MitigationState.RECOVERING, expiredAt)
                    .probationEndsAt(expiredAt.plus(settings.probation()))
                    .cleanStreak(0)
                    .build();
        }
        if (current.getState() == MitigationState.RECOVERING
                && current.getProbationEndsAt() != null
                && !now.isBefore(current.getProbationEndsAt())) {
            current = current.toBuilder()
                    .transitionTo(MitigationState.OBSERVING, current.getProbationEndsAt())
                    .suspiciousStreak(0)
                    .blockStreak(0)
                    .cleanStreak(0)
                    .relapseLevel(0)
                    .build();
        }
        return current;
    }

    private SourceState.Builder block(SourceState.Builder b, Instant now, int relapseLevel) {
        return b.transitionTo(MitigationState.BLOCKED, now)
                .blockExpiresAt(now.plus(settings.blockDurationFor(relapseLevel)))
                .relapseLevel(relapseLevel)
                .suspiciousStreak(0)
                .blockStreak(0)
                .cleanStreak(0);
    }

    // ---------------------------------------------------------------
    // Outcomes (outside the store lock)
    // ---------------------------------------------------------------

    private Optional<TransitionOutcome> describe(StateChange change, FusedVerdict verdict, Instant now,
            boolean manual) {
        SourceState before = change.previous();
        SourceState after = change.current();
        if (before.getGeneration() == after.getGeneration()) {
            return Optional.empty();
        }
        rearmTimer(before, after);

        MitigationState from = before.getState();
        MitigationState to = after.getState();
        SourceIdentity identity = after.getIdentity();
        MitigationAction action = null;
        AlertEvent alert = null;

        if (to == MitigationState.BLOCKED) {
            boolean relapse = from == MitigationState.RECOVERING;
            String reason = relapse
                    ? String.format("relapse %d during probation, score %.3f", after.getRelapseLevel(), score(verdict))
                    : String.format("score %.3f at or above block threshold %.2f for %d consecutive verdict(s)",
                            score(verdict), settings.getBlockThreshold(), settings.getBlockConfirmations());
            action = action(identity, ActionKind.BLOCK, verdict, reason, now, after.getBlockExpiresAt());
            alert = alert(identity, relapse ? Severity.CRITICAL : Severity.HIGH, verdict, now,
                    String.format("%s blocked until %s: %s", identity, after.getBlockExpiresAt(), reason));
            metrics.increment(MetricNames.MITIGATION_BLOCK);
            if (relapse) {
                metrics.increment(MetricNames.MITIGATION_RELAPSE);
            }
            LOG.info("BLOCK {} until {} ({})", identity, after.getBlockExpiresAt(), reason);
        } else if (from == MitigationState.BLOCKED) {
            String reason = manual ? "manual unblock" : "block expired at " + before.getBlockExpiresAt();
            action = action(identity, ActionKind.UNBLOCK, verdict, reason, now, null);
            metrics.increment(MetricNames.MITIGATION_UNBLOCK);
            LOG.info("UNBLOCK {} ({}), now {}", identity, reason, to);
        } else if (from == MitigationState.OBSERVING && to == MitigationState.SUSPICIOUS) {
            String reason = String.format("score %.3f at or above suspicious threshold %.2f",
                    score(verdict), settings.getSuspiciousThreshold());
            action = action(identity, ActionKind.WATCH, verdict, reason, now, null);
            alert = alert(identity, Severity.forScore(score(verdict)).atLeast(Severity.MEDIUM), verdict, now,
                    identity + " is suspicious: " + reason);
            metrics.increment(MetricNames.MITIGATION_SUSPICIOUS);
            LOG.debug("{} OBSERVING -> SUSPICIOUS ({})", identity, reason);
        } else if (to == MitigationState.OBSERVING) {
            metrics.increment(MetricNames.MITIGATION_CLEARED);
            LOG.debug("{} {} -> OBSERVING", identity, from);
        }
        return Optional.of(new TransitionOutcome(from, after, action, alert));
    }

    private void rearmTimer(SourceState before, SourceState after) {
        Instant due = switch (after.getState()) {
            case BLOCKED -> after.getBlockExpiresAt();
            case RECOVERING -> after.getProbationEndsAt();
            default -> null;
        };
        if (due != null) {
            timers.schedule(after.getIdentity(), after.getGeneration(), due);
        } else if (before.getState().isTimed()) {
            timers.cancel(after.getIdentity());
        }
    }

    private static MitigationAction action(SourceIdentity identity, ActionKind kind, FusedVerdict verdict,
            String reason, Instant now, Instant expiresAt) {
        return MitigationAction.builder()
                .sourceIdentity(identity)
                .action(kind)
                .verdict(verdict)
                .reason(reason)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .build();
    }

    private static AlertEvent alert(SourceIdentity identity, Severity severity, FusedVerdict verdict,
            Instant now, String summary) {
        AttackType attackType = verdict != null ? AttackClassifier.classify(verdict.getVector()) : AttackType.UNKNOWN;
        return AlertEvent.builder()
                .severity(severity)
                .sourceIdentity(identity)
                .summary(attackType == AttackType.UNKNOWN ? summary : attackType.getLabel() + ": " + summary)
                .verdict(verdict)
                .attackType(attackType)
                .timestamp(now)
                .build();
    }

    private static double score(FusedVerdict verdict) {
        return verdict != null ? verdict.getScore() : Double.NaN;
    }
}
