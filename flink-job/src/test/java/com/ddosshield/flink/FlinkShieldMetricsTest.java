package com.ddosshield.flink;

import com.ddosshield.core.metrics.MetricNames;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.metrics.SimpleCounter;
import org.apache.flink.metrics.groups.UnregisteredMetricsGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlinkShieldMetrics}.
 */
class FlinkShieldMetricsTest {

    private final RecordingGroup group = new RecordingGroup();
    private final FlinkShieldMetrics metrics = new FlinkShieldMetrics(group);

    @Test
    @DisplayName("Counters are registered once under underscore names and incremented")
    void shouldCount() {
        metrics.increment(MetricNames.MITIGATION_BLOCK);
        metrics.increment(MetricNames.MITIGATION_BLOCK);
        metrics.increment(MetricNames.INGEST_MALFORMED);

        assertThat(group.groups).containsExactly("ddos_shield");
        assertThat(group.counters).containsOnlyKeys("mitigation_block", "ingest_malformed");
        assertThat(group.counters.get("mitigation_block").getCount()).isEqualTo(2);
        assertThat(group.counters.get("ingest_malformed").getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Observations feed a histogram")
    void shouldObserve() {
        metrics.observe(MetricNames.SCORING_LATENCY_MS, 12);
        metrics.observe(MetricNames.SCORING_LATENCY_MS, 30);

        Histogram histogram = group.histograms.get("scoring_latency_ms");
        assertThat(histogram.getCount()).isEqualTo(2);
        assertThat(histogram.getStatistics().getMax()).isEqualTo(30);
    }

    private static final class RecordingGroup extends UnregisteredMetricsGroup {
        final List<String> groups = new ArrayList<>();
        final Map<String, Counter> counters = new HashMap<>();
        final Map<String, Histogram> histograms = new HashMap<>();

        @Override
        public MetricGroup addGroup(String name) {
            groups.add(name);
            return this;
        }

        @Override
        public Counter counter(String name) {
            return counter(name, new SimpleCounter());
        }

        @Override
        public <C extends Counter> C counter(String name, C counter) {
            counters.put(name, counter);
            return counter;
        }

        @Override
        public <H extends Histogram> H histogram(String name, H histogram) {
            histograms.put(name, histogram);
            return histogram;
        }
    }
}
