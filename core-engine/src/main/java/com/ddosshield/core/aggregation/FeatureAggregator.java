package com.ddosshield.core.aggregation;

import com.ddosshield.core.config.AggregationSettings;
import com.ddosshield.core.error.MalformedEventException;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.IdentityGranularity;
import com.ddosshield.core.model.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a stream of flow events into fixed-interval feature vectors per
 * source identity.
 *
 * <h3>Windowing</h3>
 * <p>
 * Windows are fixed-size, non-overlapping and aligned to the epoch, so
 * every node computes the same boundaries for the same timestamp. Each
 * identity has at most one open window. An event for a later window closes
 * the open one; an event for a window that is already closed is late and
 * dropped. A silent identity produces no vector.
 * </p>
 *
 * <h3>Memory bound</h3>
 * <p>
 * At most {@code maxTrackedSources} identities have an open window. When a
 * new identity arrives at a full shard, the least recently active one is
 * evicted together with its partial window and a capacity event is raised.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Identities are spread over independently locked shards. Events for
 * different identities in different shards never contend.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureAggregator.class);

    static final String COMPONENT = "aggregator";

    private static final Comparator<FeatureVector> VECTOR_ORDER = Comparator
            .comparing(FeatureVector::getWindowEnd)
            .thenComparing(FeatureVector::getIdentity);

    private final long windowMillis;
    private final int maxTrackedSources;
    private final int perShardCapacity;
    private final int maxDistinctPorts;
    private final IdentityGranularity granularity;
    private final ShieldMetrics metrics;
    private final CapacityListener capacityListener;
    private final Shard[] shards;
    private final AtomicLong evictions = new AtomicLong();

    /**
     * @param settings         aggregation section of the configuration
     * @param metrics          metrics sink
     * @param capacityListener receives capacity evictions
     */
    public FeatureAggregator(AggregationSettings settings, ShieldMetrics metrics,
            CapacityListener capacityListener) {
        this(settings.window(), settings.getMaxTrackedSources(), settings.getShards(),
                settings.getMaxDistinctPorts(), settings.granularity(), metrics, capacityListener);
    }

    /**
     * @throws IllegalArgumentException if a size or the window is not positive
     */
    public FeatureAggregator(Duration window, int maxTrackedSources, int shardCount, int maxDistinctPorts,
            IdentityGranularity granularity, ShieldMetrics metrics, CapacityListener capacityListener) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        if (maxTrackedSources <= 0) {
            throw new IllegalArgumentException("maxTrackedSources must be > 0, got: " + maxTrackedSources);
        }
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0, got: " + shardCount);
        }
        if (maxDistinctPorts <= 0) {
            throw new IllegalArgumentException("maxDistinctPorts must be > 0, got: " + maxDistinctPorts);
        }
        this.windowMillis = window.toMillis();
        this.maxTrackedSources = maxTrackedSources;
        int effectiveShards = Math.min(shardCount, maxTrackedSources);
        this.perShardCapacity = (maxTrackedSources + effectiveShards - 1) / effectiveShards;
        this.maxDistinctPorts = maxDistinctPorts;
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.capacityListener = Objects.requireNonNull(capacityListener, "capacityListener must not be null");
        this.shards = new Shard[effectiveShards];
        for (int i = 0; i < effectiveShards; i++) {
            shards[i] = new Shard(perShardCapacity);
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Fold one event into its identity's open window.
     *
     * @param event raw flow event
     * @return the identity the event was accounted to
     * @throws MalformedEventException if the identity or timestamp is absent or
     *                                 invalid
     */
    public SourceIdentity ingest(FlowEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        event.validate();
        SourceIdentity identity = event.identity(granularity);

        long ts = event.getTimestamp().toEpochMilli();
        long start = ts - Math.floorMod(ts, windowMillis);

        Shard shard = shardFor(identity);
        shard.lock.lock();
        try {
            Long closedUpTo = shard.watermarks.get(identity);
            if (closedUpTo != null && start < closedUpTo) {
                late(identity, event);
                return identity;
            }

            WindowAccumulator open = shard.open.get(identity);
            if (open == null) {
                if (shard.open.size() >= perShardCapacity) {
                    evictEldest(shard);
                }
                open = newWindow(identity, start);
                shard.open.put(identity, open);
            } else if (start > open.start().toEpochMilli()) {
                closeInto(shard, identity, open);
                open = newWindow(identity, start);
                shard.open.put(identity, open);
            } else if (start < open.start().toEpochMilli()) {
                late(identity, event);
                return identity;
            }
            open.add(event);
        } finally {
            shard.lock.unlock();
        }
        return identity;
    }

    /**
     * Close every window whose end is at or before {@code now}.
     *
     * @param now current time
     * @return closed vectors ordered by window end, then identity
     */
    public List<FeatureVector> flushDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        List<FeatureVector> out = new ArrayList<>();
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<Map.Entry<SourceIdentity, WindowAccumulator>> it = shard.open.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<SourceIdentity, WindowAccumulator> entry = it.next();
                    if (!entry.getValue().end().isAfter(now)) {
                        it.remove();
                        closeInto(shard, entry.getKey(), entry.getValue());
                    }
                }
                out.addAll(shard.completed);
                shard.completed.clear();
            } finally {
                shard.lock.unlock();
            }
        }
        return finish(out);
    }

    /**
     * Close due windows of a single identity only. Used by hosts that drive
     * flushing per key.
     *
     * @param identity identity to flush
     * @param now      current time
     * @return that identity's closed vectors in window order
     */
    public List<FeatureVector> flushDue(SourceIdentity identity, Instant now) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(now, "now must not be null");
        List<FeatureVector> out = new ArrayList<>();
        Shard shard = shardFor(identity);
        shard.lock.lock();
        try {
            WindowAccumulator open = shard.open.get(identity);
            if (open != null && !open.end().isAfter(now)) {
                shard.open.remove(identity);
                closeInto(shard, identity, open);
            }
            shard.completed.removeIf(vector -> {
                if (vector.getIdentity().equals(identity)) {
                    out.add(vector);
                    return true;
                }
                return false;
            });
        } finally {
            shard.lock.unlock();
        }
        return finish(out);
    }

    /**
     * @param timestamp any instant
     * @return end of the aligned window containing {@code timestamp}
     */
    public Instant windowEndFor(Instant timestamp) {
        long ts = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(ts - Math.floorMod(ts, windowMillis) + windowMillis);
    }

    /**
     * @return number of identities with an open window
     */
    public int trackedSources() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                total += shard.open.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    public IdentityGranularity getGranularity() {
        return granularity;
    }

    public Duration getWindow() {
        return Duration.ofMillis(windowMillis);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Shard shardFor(SourceIdentity identity) {
        return shards[Math.floorMod(identity.hashCode(), shards.length)];
    }

    private WindowAccumulator newWindow(SourceIdentity identity, long start) {
        return new WindowAccumulator(identity, Instant.ofEpochMilli(start),
                Instant.ofEpochMilli(start + windowMillis), maxDistinctPorts);
    }

    private void closeInto(Shard shard, SourceIdentity identity, WindowAccumulator window) {
        shard.completed.add(window.toVector());
        shard.watermarks.put(identity, window.end().toEpochMilli());
        metrics.increment(MetricNames.AGGREGATION_VECTORS);
    }

    private void evictEldest(Shard shard) {
        Iterator<Map.Entry<SourceIdentity, WindowAccumulator>> it = shard.open.entrySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        SourceIdentity evicted = it.next().getKey();
        it.remove();
        metrics.increment(MetricNames.AGGREGATION_EVICTED);
        long total = evictions.incrementAndGet();
        if (total == 1 || total % 1000 == 0) {
            LOG.warn("Aggregator at capacity ({} tracked sources), evicted least recently active {} "
                    + "({} evictions so far)", maxTrackedSources, evicted, total);
        }
        capacityListener.onCapacityExceeded(COMPONENT, evicted, maxTrackedSources);
    }

    private void late(SourceIdentity identity, FlowEvent event) {
        metrics.increment(MetricNames.AGGREGATION_LATE);
        LOG.debug("Dropping late event for {} at {}", identity, event.getTimestamp());
    }

    private static List<FeatureVector> finish(List<FeatureVector> vectors) {
        vectors.sort(VECTOR_ORDER);
        return vectors;
    }

    private static final class Shard {
        final ReentrantLock lock = new ReentrantLock();
        final LinkedHashMap<SourceIdentity, WindowAccumulator> open = new LinkedHashMap<>(16, 0.75f, true);
        final List<FeatureVector> completed = new ArrayList<>();
        final Map<SourceIdentity, Long> watermarks;

        Shard(int capacity) {
            // end of the last closed window per identity, bounded like the open table
            this.watermarks = new LinkedHashMap<>(16, 0.75f, true) {
                private static final long serialVersionUID = 1L;

                @Override
                protected boolean removeEldestEntry(Map.Entry<SourceIdentity, Long> eldest) {
                    return size() > capacity;
                }
            };
        }
    }
}
