package com.ddosshield.core.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryShieldMetrics}.
 */
class InMemoryShieldMetricsTest {

    @Test
    @DisplayName("Counters are exact under concurrent increments")
    void shouldCountConcurrently() {
        InMemoryShieldMetrics metrics = new InMemoryShieldMetrics();

        IntStream.range(0, 10_000).parallel().forEach(i -> metrics.increment(MetricNames.INGEST_ACCEPTED));

        assertThat(metrics.count(MetricNames.INGEST_ACCEPTED)).isEqualTo(10_000);
        assertThat(metrics.count(MetricNames.INGEST_BUSY)).isZero();
    }

    @Test
    @DisplayName("Observations report their mean and zero when absent")
    void shouldAverageObservations() {
        InMemoryShieldMetrics metrics = new InMemoryShieldMetrics();
        metrics.observe(MetricNames.SCORING_LATENCY_MS, 10);
        metrics.observe(MetricNames.SCORING_LATENCY_MS, 30);

        assertThat(metrics.mean(MetricNames.SCORING_LATENCY_MS)).isEqualTo(20.0);
        assertThat(metrics.mean("unknown")).isZero();
    }

    @Test
    @DisplayName("Snapshot is sorted and every update reaches the delegate")
    void shouldSnapshotAndForward() {
        List<String> forwarded = new ArrayList<>();
        InMemoryShieldMetrics metrics = new InMemoryShieldMetrics(new ShieldMetrics() {
            @Override
            public void increment(String key) {
                forwarded.add(key);
            }

            @Override
            public void observe(String key, long value) {
                forwarded.add(key + "=" + value);
            }
        });

        metrics.increment(MetricNames.MITIGATION_BLOCK);
        metrics.increment(MetricNames.DISPATCH_DELIVERED);
        metrics.observe(MetricNames.SCORING_LATENCY_MS, 7);

        assertThat(metrics.snapshot().keySet())
                .containsExactly(MetricNames.DISPATCH_DELIVERED, MetricNames.MITIGATION_BLOCK);
        assertThat(forwarded).containsExactly(MetricNames.MITIGATION_BLOCK, MetricNames.DISPATCH_DELIVERED,
                MetricNames.SCORING_LATENCY_MS + "=7");
    }
}
