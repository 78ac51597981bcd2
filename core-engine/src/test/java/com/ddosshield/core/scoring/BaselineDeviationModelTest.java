package com.ddosshield.core.scoring;

import com.ddosshield.core.model.ModelScore;
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
 * Unit tests for {@link BaselineDeviationModel}.
 */
class BaselineDeviationModelTest {

    private BaselineDeviationModel model;

    @BeforeEach
    void setUp() {
        Map<String, Double> means = new LinkedHashMap<>();
        means.put("packet_rate", 10.0);
        means.put("flow_rate", 4.0);
        ModelArtifact artifact = new ModelArtifact();
        artifact.setMeans(means);
        artifact.setStddevs(Map.of("packet_rate", 2.0, "flow_rate", 1.0));
        model = new BaselineDeviationModel("dev", artifact);
    }

    @Test
    @DisplayName("Baseline traffic scores low")
    void shouldScoreLowAtBaseline() {
        ModelScore score = model.score(vector(Map.of("packet_rate", 10.0, "flow_rate", 4.0)), Instant.MAX);

        assertThat(score.getScore()).isCloseTo(1.0 / (1.0 + Math.exp(4.5)), within(1e-9));
        assertThat(score.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A deviation equal to the pivot scores 0.5")
    void shouldScoreHalfAtPivot() {
        ModelScore score = model.score(vector(Map.of("packet_rate", 16.0, "flow_rate", 7.0)), Instant.MAX);

        assertThat(score.getScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Confidence reflects the share of baseline features present")
    void shouldReduceConfidenceForMissingFeatures() {
        ModelScore score = model.score(vector(Map.of("packet_rate", 10.0)), Instant.MAX);

        assertThat(score.getConfidence()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Extreme values saturate instead of overflowing")
    void shouldSaturate() {
        ModelScore score = model.score(vector(Map.of("packet_rate", 1e300, "flow_rate", 4.0)), Instant.MAX);

        assertThat(score.getScore()).isBetween(0.99, 1.0);
    }

    @Test
    @DisplayName("Should reject an artifact without means")
    void shouldRejectEmptyArtifact() {
        assertThatThrownBy(() -> new BaselineDeviationModel("dev", new ModelArtifact()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
