package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.ddosshield.core.TestFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RateThresholdModel}.
 */
class RateThresholdModelTest {

    private RateThresholdModel model;

    @BeforeEach
    void setUp() {
        Map<String, Double> limits = new LinkedHashMap<>();
        limits.put("packet_rate", 1000.0);
        limits.put("flow_rate", 50.0);
        ModelArtifact artifact = new ModelArtifact();
        artifact.setThresholds(limits);
        model = new RateThresholdModel("thr", artifact);
    }

    @Test
    @DisplayName("A rate exactly at its limit scores 0.5")
    void shouldScoreHalfAtLimit() {
        assertThat(model.score(vector(Map.of("packet_rate", 1000.0, "flow_rate", 0.0)), Instant.MAX).getScore())
                .isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("The most exceeded limit decides the score")
    void shouldUseWorstRatio() {
        double score = model.score(vector(Map.of("packet_rate", 10.0, "flow_rate", 150.0)), Instant.MAX)
                .getScore();

        assertThat(score).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Idle traffic scores zero")
    void shouldScoreZeroWhenIdle() {
        assertThat(model.score(vector(Map.of("packet_rate", 0.0, "flow_rate", 0.0)), Instant.MAX).getScore())
                .isZero();
    }

    @Test
    @DisplayName("Confidence is the share of limits that could be checked")
    void shouldReportPartialConfidence() {
        assertThat(model.score(vector(Map.of("packet_rate", 1.0)), Instant.MAX).getConfidence())
                .isEqualTo(0.5);
        assertThat(model.supportsAttribution()).isFalse();
    }

    @Test
    @DisplayName("Should be unavailable when no limited feature is present")
    void shouldFailWithoutFeatures() {
        assertThatThrownBy(() -> model.score(vector(Map.of("byte_rate", 1.0)), Instant.MAX))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    @DisplayName("Should reject non-positive limits")
    void shouldRejectNonPositiveLimit() {
        ModelArtifact artifact = new ModelArtifact();
        artifact.setThresholds(Map.of("packet_rate", 0.0));

        assertThatThrownBy(() -> new RateThresholdModel("thr", artifact))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive limit");
    }
}
