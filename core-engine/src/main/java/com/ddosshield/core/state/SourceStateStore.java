package com.ddosshield.core.state;

import com.ddosshield.core.aggregation.CapacityListener;
import com.ddosshield.core.config.MitigationSettings;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.SourceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Sharded, in-memory table of per-source mitigation state.
 *
 * <h3>Atomicity</h3>
 * <p>
 * Every read-modify-write runs under the lock of the identity's shard, so
 * transitions for one identity are serialized while identities in other
 * shards proceed independently. Operators passed to
 * {@code compareAndTransition} run under that lock and must be pure
 * computations: no I/O, no model calls, no calls back into the store.
 * </p>
 *
 * <h3>Bounds</h3>
 * <p>
 * Each shard holds at most {@code ceil(maxEntries / shards)} entries. When a
 * new identity arrives at a full shard the least recently used entry that is
 * not {@link com.ddosshield.core.model.MitigationState#isTimed() timed} is
 * evicted. Blocked and recovering sources are never evicted: if a shard
 * holds nothing else it grows past its bound and a warning is logged.
 * </p>
 *
 * @since 1.0.0
 */
public class SourceStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(SourceStateStore.class);

    static final String COMPONENT = "state-store";

    private final Shard[] shards;
    private final int maxEntries;
    private final int perShardCapacity;
    private final ShieldMetrics metrics;
    private final CapacityListener capacityListener;
    private final AtomicLong evictions = new AtomicLong();

    public SourceStateStore(MitigationSettings settings, ShieldMetrics metrics, CapacityListener capacityListener) {
        this(settings.getShards(), settings.getMaxTrackedSources(), metrics, capacityListener);
    }

    /**
     * @throws IllegalArgumentException if {@code shardCount} or
     *                                  {@code maxEntries} is not positive
     */
    public SourceStateStore(int shardCount, int maxEntries, ShieldMetrics metrics,
            CapacityListener capacityListener) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0, got: " + shardCount);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        int effectiveShards = Math.min(shardCount, maxEntries);
        this.shards = new Shard[effectiveShards];
        for (int i = 0; i < effectiveShards; i++) {
            shards[i] = new Shard();
        }
        this.maxEntries = maxEntries;
        this.perShardCapacity = (maxEntries + effectiveShards - 1) / effectiveShards;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.capacityListener = Objects.requireNonNull(capacityListener, "capacityListener must not be null");
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @param identity source identity
     * @return current state, if the identity is tracked
     */
    public Optional<SourceState> get(SourceIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        Shard shard = shardFor(identity);
        shard.lock.lock();
        try {
            return Optional.ofNullable(shard.entries.get(identity));
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Return the identity's state, creating a default
     * {@link com.ddosshield.core.model.MitigationState#OBSERVING} entry if
     * none exists.
     */
    public SourceState getOrInit(SourceIdentity identity, Instant now) {
        return compareAndTransition(identity, now, UnaryOperator.identity()).current();
    }

    /**
     * @param filter states to include
     * @return matching states ordered by identity
     */
    public List<SourceState> snapshot(Predicate<SourceState> filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        List<SourceState> out = new ArrayList<>();
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                for (SourceState state : shard.entries.values()) {
                    if (filter.test(state)) {
                        out.add(state);
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        out.sort((a, b) -> a.getIdentity().compareTo(b.getIdentity()));
        return out;
    }

    public int size() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                total += shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    // ---------------------------------------------------------------
    // Atomic updates
    // ---------------------------------------------------------------

    /**
     * Atomically apply {@code operator} to the identity's state, creating a
     * default entry first if none exists.
     *
     * @param identity source identity
     * @param now      creation time for a new entry
     * @param operator pure function from current to next state
     * @return previous and new state
     */
    public StateChange compareAndTransition(SourceIdentity identity, Instant now,
            UnaryOperator<SourceState> operator) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Shard shard = shardFor(identity);
        shard.lock.lock();
        try {
            SourceState previous = shard.entries.get(identity);
            if (previous == null) {
                makeRoom(shard);
                previous = SourceState.initial(identity, now);
            }
            SourceState next = apply(identity, previous, operator);
            shard.entries.put(identity, next);
            return new StateChange(previous, next);
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Apply {@code operator} only if the identity is tracked and its state
     * still has generation {@code expectedGeneration}. Used by timers, which
     * must not act on a state that has moved on since they were armed.
     *
     * @return the change, or empty if the entry is gone or the generation
     *         differs
     */
    public Optional<StateChange> compareAndTransition(SourceIdentity identity, long expectedGeneration,
            UnaryOperator<SourceState> operator) {
        return update(identity, state -> state.getGeneration() == expectedGeneration, operator);
    }

    /**
     * Apply {@code operator} to an existing entry only; never creates one.
     *
     * @return the change, or empty if the identity is not tracked
     */
    public Optional<StateChange> transitionIfPresent(SourceIdentity identity, UnaryOperator<SourceState> operator) {
        return update(identity, state -> true, operator);
    }

    /**
     * Remove every entry last seen before {@code before}. Blocked and
     * recovering entries are kept regardless of age.
     *
     * @param before idle cut-off
     * @return the removed states
     */
    public List<SourceState> evictIdle(Instant before) {
        Objects.requireNonNull(before, "before must not be null");
        List<SourceState> evicted = new ArrayList<>();
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<SourceState> it = shard.entries.values().iterator();
                while (it.hasNext()) {
                    SourceState state = it.next();
                    if (!state.getState().isTimed() && state.getLastSeenAt().isBefore(before)) {
                        it.remove();
                        evicted.add(state);
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        for (int i = 0; i < evicted.size(); i++) {
            metrics.increment(MetricNames.STATE_IDLE_EVICTED);
        }
        if (!evicted.isEmpty()) {
            LOG.debug("Evicted {} idle source state(s) last seen before {}", evicted.size(), before);
        }
        return evicted;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<StateChange> update(SourceIdentity identity, Predicate<SourceState> guard,
            UnaryOperator<SourceState> operator) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Shard shard = shardFor(identity);
        shard.lock.lock();
        try {
            SourceState previous = shard.entries.get(identity);
            if (previous == null || !guard.test(previous)) {
                return Optional.empty();
            }
            SourceState next = apply(identity, previous, operator);
            shard.entries.put(identity, next);
            return Optional.of(new StateChange(previous, next));
        } finally {
            shard.lock.unlock();
        }
    }

    private static SourceState apply(SourceIdentity identity, SourceState previous,
            UnaryOperator<SourceState> operator) {
        SourceState next = Objects.requireNonNull(operator.apply(previous), "operator returned null");
        if (!next.getIdentity().equals(identity)) {
            throw new IllegalStateException("operator changed identity from " + identity + " to "
                    + next.getIdentity());
        }
        return next;
    }

    private void makeRoom(Shard shard) {
        if (shard.entries.size() < perShardCapacity) {
            return;
        }
        Iterator<SourceState> it = shard.entries.values().iterator();
        while (it.hasNext()) {
            SourceState candidate = it.next();
            if (!candidate.getState().isTimed()) {
                it.remove();
                metrics.increment(MetricNames.STATE_EVICTED);
                long total = evictions.incrementAndGet();
                if (total == 1 || total % 1000 == 0) {
                    LOG.warn("State store at capacity ({} sources), evicted least recently used {} "
                            + "({} evictions so far)", maxEntries, candidate.getIdentity(), total);
                }
                capacityListener.onCapacityExceeded(COMPONENT, candidate.getIdentity(), maxEntries);
                return;
            }
        }
        LOG.warn("State store shard holds only blocked or recovering sources; growing past {} entries",
                perShardCapacity);
    }

    private Shard shardFor(SourceIdentity identity) {
        return shards[Math.floorMod(identity.hashCode(), shards.length)];
    }

    private static final class Shard {
        final ReentrantLock lock = new ReentrantLock();
        final Map<SourceIdentity, SourceState> entries = new LinkedHashMap<>(16, 0.75f, true);
    }
}
