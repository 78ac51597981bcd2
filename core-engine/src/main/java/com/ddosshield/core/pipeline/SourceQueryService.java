package com.ddosshield.core.pipeline;

import com.ddosshield.core.aggregation.FeatureAggregator;
import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.MitigationState;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.SourceState;
import com.ddosshield.core.state.SourceStateStore;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view for dashboard and report collaborators.
 *
 * @since 1.0.0
 */
public class SourceQueryService {

    private final SourceStateStore store;
    private final VerdictHistory history;
    private final FeatureAggregator aggregator;
    private final InMemoryShieldMetrics metrics;

    public SourceQueryService(SourceStateStore store, VerdictHistory history, FeatureAggregator aggregator,
            InMemoryShieldMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * @return the source's state; empty if the source is not tracked, which
     *         is equivalent to {@link MitigationState#OBSERVING}
     */
    public Optional<SourceState> currentState(SourceIdentity identity) {
        return store.get(identity);
    }

    /**
     * @return the source's most recent verdicts, oldest first
     */
    public List<FusedVerdict> recentVerdicts(SourceIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        return history.recent(identity);
    }

    /**
     * @return currently blocked sources ordered by identity
     */
    public List<SourceState> blockedSources() {
        return store.snapshot(state -> state.getState() == MitigationState.BLOCKED);
    }

    public ShieldStats stats() {
        Map<MitigationState, Long> byState = new EnumMap<>(MitigationState.class);
        List<SourceState> all = store.snapshot(state -> true);
        for (SourceState state : all) {
            byState.merge(state.getState(), 1L, Long::sum);
        }
        return new ShieldStats(all.size(), aggregator.trackedSources(),
                byState.getOrDefault(MitigationState.SUSPICIOUS, 0L),
                byState.getOrDefault(MitigationState.BLOCKED, 0L),
                byState.getOrDefault(MitigationState.RECOVERING, 0L),
                metrics.snapshot());
    }
}
