package com.ddosshield.core.metrics;

/**
 * Metrics port of the mitigation engine.
 *
 * <p>
 * Keeps the core free of any metrics SDK. The Flink job adapts it onto its
 * {@code MetricGroup}; standalone pipelines use
 * {@link InMemoryShieldMetrics}. Implementations must be safe for concurrent
 * use and must not block.
 * </p>
 *
 * @since 1.0.0
 */
public interface ShieldMetrics {

    /**
     * Increment the named counter by one.
     *
     * @param key dotted metric name, see {@link MetricNames}
     */
    void increment(String key);

    /**
     * Record one observation (latency, size, depth).
     *
     * @param key   dotted metric name
     * @param value observed value
     */
    void observe(String key, long value);

    /** Metrics implementation that ignores every update. */
    ShieldMetrics NO_OP = new ShieldMetrics() {
        @Override
        public void increment(String key) {
        }

        @Override
        public void observe(String key, long value) {
        }
    };
}
