package com.ddosshield.core.aggregation;

import com.ddosshield.core.error.MalformedEventException;
import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.model.FeatureNames;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.IdentityGranularity;
import com.ddosshield.core.model.Protocol;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.TcpFlag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureAggregator}.
 */
class FeatureAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final SourceIdentity SOURCE_A = SourceIdentity.of("10.0.0.1");
    private static final SourceIdentity SOURCE_B = SourceIdentity.of("10.0.0.2");

    private InMemoryShieldMetrics metrics;
    private List<SourceIdentity> evicted;
    private FeatureAggregator aggregator;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryShieldMetrics();
        evicted = new ArrayList<>();
        aggregator = aggregator(100, 4);
    }

    private FeatureAggregator aggregator(int maxTrackedSources, int shards) {
        return new FeatureAggregator(Duration.ofSeconds(10), maxTrackedSources, shards, 64,
                IdentityGranularity.ADDRESS, metrics,
                (component, identity, capacity) -> evicted.add(identity));
    }

    private static FlowEvent syn(String address, Instant at, int sourcePort) {
        return FlowEvent.builder()
                .sourceAddress(address)
                .sourcePort(sourcePort)
                .destinationPort(80)
                .protocol(Protocol.TCP)
                .flag(TcpFlag.SYN)
                .timestamp(at)
                .bytes(600)
                .packets(10)
                .durationMillis(500)
                .build();
    }

    @Test
    @DisplayName("Should derive rates, ratios and entropies for a closed window")
    void shouldComputeFeatures() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(2), 1001));
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(3), 1002));

        List<FeatureVector> vectors = aggregator.flushDue(T0.plusSeconds(10));

        assertThat(vectors).hasSize(1);
        FeatureVector v = vectors.get(0);
        assertThat(v.getIdentity()).isEqualTo(SOURCE_A);
        assertThat(v.getWindowStart()).isEqualTo(T0);
        assertThat(v.getWindowEnd()).isEqualTo(T0.plusSeconds(10));
        assertThat(v.getEventCount()).isEqualTo(3);
        assertThat(v.getFeatures()).containsOnlyKeys(FeatureNames.ALL);
        assertThat(v.valueOr(FeatureNames.PACKET_RATE, -1)).isCloseTo(3.0, within(1e-9));
        assertThat(v.valueOr(FeatureNames.BYTE_RATE, -1)).isCloseTo(180.0, within(1e-9));
        assertThat(v.valueOr(FeatureNames.FLOW_RATE, -1)).isCloseTo(0.3, within(1e-9));
        assertThat(v.valueOr(FeatureNames.PACKET_SIZE_AVG, -1)).isCloseTo(60.0, within(1e-9));
        assertThat(v.valueOr(FeatureNames.PACKET_SIZE_STD, -1)).isCloseTo(0.0, within(1e-9));
        assertThat(v.valueOr(FeatureNames.INTER_ARRIVAL_TIME, -1)).isCloseTo(1.0, within(1e-9));
        assertThat(v.valueOr(FeatureNames.FLOW_DURATION_AVG, -1)).isCloseTo(0.5, within(1e-9));
        assertThat(v.valueOr(FeatureNames.PROTOCOL_TCP, -1)).isEqualTo(1.0);
        assertThat(v.valueOr(FeatureNames.PROTOCOL_UDP, -1)).isEqualTo(0.0);
        assertThat(v.valueOr(FeatureNames.FLAG_SYN, -1)).isEqualTo(1.0);
        assertThat(v.valueOr(FeatureNames.FLAG_ACK, -1)).isEqualTo(0.0);
        assertThat(v.valueOr(FeatureNames.SRC_PORT_ENTROPY, -1))
                .isCloseTo(Math.log(3) / Math.log(2), within(1e-9));
        assertThat(v.valueOr(FeatureNames.DST_PORT_ENTROPY, -1)).isEqualTo(0.0);
        assertThat(metrics.count(MetricNames.AGGREGATION_VECTORS)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not close a window before its end")
    void shouldKeepOpenWindowUntilDue() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));

        assertThat(aggregator.flushDue(T0.plusMillis(9_999))).isEmpty();
        assertThat(aggregator.trackedSources()).isEqualTo(1);
        assertThat(aggregator.flushDue(T0.plusSeconds(10))).hasSize(1);
        assertThat(aggregator.trackedSources()).isZero();
    }

    @Test
    @DisplayName("An event for a later window closes the open one")
    void shouldCloseWindowOnLaterEvent() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(15), 1000));

        List<FeatureVector> vectors = aggregator.flushDue(T0.plusSeconds(12));

        assertThat(vectors).extracting(FeatureVector::getWindowStart).containsExactly(T0);
        assertThat(aggregator.trackedSources()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop events for windows that are already closed")
    void shouldDropLateEvents() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        assertThat(aggregator.flushDue(T0.plusSeconds(10))).hasSize(1);

        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(5), 1000));

        assertThat(metrics.count(MetricNames.AGGREGATION_LATE)).isEqualTo(1);
        assertThat(aggregator.flushDue(T0.plusSeconds(60))).isEmpty();
    }

    @Test
    @DisplayName("A silent source produces no vector")
    void shouldEmitNothingForSilentSource() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        aggregator.flushDue(T0.plusSeconds(10));

        assertThat(aggregator.flushDue(T0.plusSeconds(100))).isEmpty();
    }

    @Test
    @DisplayName("Should order flushed vectors by window end, then identity")
    void shouldOrderOutput() {
        aggregator.ingest(syn("10.0.0.2", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(2), 1000));
        aggregator.ingest(syn("10.0.0.2", T0.plusSeconds(11), 1000));

        List<FeatureVector> vectors = aggregator.flushDue(T0.plusSeconds(20));

        assertThat(vectors).extracting(FeatureVector::getIdentity)
                .containsExactly(SOURCE_A, SOURCE_B, SOURCE_B);
        assertThat(vectors).extracting(FeatureVector::getWindowEnd)
                .containsExactly(T0.plusSeconds(10), T0.plusSeconds(10), T0.plusSeconds(20));
    }

    @Test
    @DisplayName("Should flush a single identity without touching others")
    void shouldFlushSingleIdentity() {
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.2", T0.plusSeconds(1), 1000));

        assertThat(aggregator.flushDue(SOURCE_A, T0.plusSeconds(10)))
                .extracting(FeatureVector::getIdentity)
                .containsExactly(SOURCE_A);
        assertThat(aggregator.trackedSources()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should evict the least recently active source at capacity")
    void shouldEvictAtCapacity() {
        aggregator = aggregator(2, 1);

        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.2", T0.plusSeconds(1), 1000));
        aggregator.ingest(syn("10.0.0.1", T0.plusSeconds(2), 1000));
        aggregator.ingest(syn("10.0.0.3", T0.plusSeconds(3), 1000));

        assertThat(evicted).containsExactly(SOURCE_B);
        assertThat(aggregator.trackedSources()).isEqualTo(2);
        assertThat(metrics.count(MetricNames.AGGREGATION_EVICTED)).isEqualTo(1);
        assertThat(aggregator.flushDue(T0.plusSeconds(10)))
                .extracting(FeatureVector::getIdentity)
                .doesNotContain(SOURCE_B);
    }

    @Test
    @DisplayName("Should reject events without a source address")
    void shouldRejectMalformedEvent() {
        FlowEvent event = FlowEvent.builder().timestamp(T0).protocol(Protocol.UDP).build();

        assertThatThrownBy(() -> aggregator.ingest(event))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("sourceAddress");
    }

    @Test
    @DisplayName("Windows are aligned to the epoch")
    void shouldAlignWindows() {
        assertThat(aggregator.windowEndFor(T0.plusSeconds(3))).isEqualTo(T0.plusSeconds(10));
        assertThat(aggregator.windowEndFor(T0.plusSeconds(10))).isEqualTo(T0.plusSeconds(20));
    }
}
