package com.ddosshield.core.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counter-keeping metrics, optionally forwarding every update to a delegate.
 *
 * <p>
 * Backs the stats snapshot of the query interface. Observations keep a
 * running count and sum so that a mean can be reported.
 * </p>
 */
public class InMemoryShieldMetrics implements ShieldMetrics {

    private final ShieldMetrics delegate;
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> observationSums = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> observationCounts = new ConcurrentHashMap<>();

    public InMemoryShieldMetrics() {
        this(ShieldMetrics.NO_OP);
    }

    /**
     * @param delegate metrics sink that also receives every update
     */
    public InMemoryShieldMetrics(ShieldMetrics delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void increment(String key) {
        counters.computeIfAbsent(key, k -> new LongAdder()).increment();
        delegate.increment(key);
    }

    @Override
    public void observe(String key, long value) {
        observationSums.computeIfAbsent(key, k -> new LongAdder()).add(value);
        observationCounts.computeIfAbsent(key, k -> new LongAdder()).increment();
        delegate.observe(key, value);
    }

    /**
     * @param key counter name
     * @return current count, zero if never incremented
     */
    public long count(String key) {
        LongAdder adder = counters.get(key);
        return adder != null ? adder.sum() : 0L;
    }

    /**
     * @param key observation name
     * @return mean of all observations, or {@code 0} if none
     */
    public double mean(String key) {
        LongAdder n = observationCounts.get(key);
        if (n == null || n.sum() == 0) {
            return 0.0;
        }
        return (double) observationSums.get(key).sum() / n.sum();
    }

    /**
     * @return sorted copy of all counters
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }
}
