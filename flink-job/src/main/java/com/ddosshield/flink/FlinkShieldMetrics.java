package com.ddosshield.flink;

import com.ddosshield.core.metrics.ShieldMetrics;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapts the engine's {@link ShieldMetrics} port onto a Flink
 * {@link MetricGroup}.
 *
 * <p>
 * Counters and histograms are registered lazily under the
 * {@code ddos_shield} group the first time a key is used. Dotted keys become
 * underscore names, so {@code mitigation.block} is exported as
 * {@code ddos_shield_mitigation_block}. The reporter (e.g. Prometheus) is
 * configured at cluster level.
 * </p>
 */
public class FlinkShieldMetrics implements ShieldMetrics {

    private static final int HISTOGRAM_WINDOW = 350;

    private final MetricGroup group;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public FlinkShieldMetrics(MetricGroup metricGroup) {
        Objects.requireNonNull(metricGroup, "metricGroup must not be null");
        this.group = metricGroup.addGroup("ddos_shield");
    }

    @Override
    public void increment(String key) {
        counters.computeIfAbsent(key, k -> group.counter(metricName(k))).inc();
    }

    @Override
    public void observe(String key, long value) {
        histograms.computeIfAbsent(key,
                k -> group.histogram(metricName(k), new DescriptiveStatisticsHistogram(HISTOGRAM_WINDOW)))
                .update(value);
    }

    static String metricName(String key) {
        return key.replace('.', '_');
    }
}
