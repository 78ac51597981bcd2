package com.ddosshield.core.explain;

import com.ddosshield.core.config.ExplainSettings;
import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.model.Explanation;
import com.ddosshield.core.model.FeatureContribution;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.ModelScore;
import com.ddosshield.core.scoring.LogisticRegressionModel;
import com.ddosshield.core.scoring.ModelArtifact;
import com.ddosshield.core.scoring.ModelExecutor;
import com.ddosshield.core.scoring.RegisteredModel;
import com.ddosshield.core.scoring.ScoringModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.ddosshield.core.TestFixtures.T0;
import static com.ddosshield.core.TestFixtures.fixed;
import static com.ddosshield.core.TestFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Explainer}.
 */
class ExplainerTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private InMemoryShieldMetrics metrics;
    private ModelExecutor executor;
    private Clock clock;
    private ExplainSettings settings;
    private RegisteredModel logistic;
    private FeatureVector vector;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryShieldMetrics();
        settings = new ExplainSettings();
        settings.setTimeoutMillis(1_000);
        clock = Clock.systemUTC();

        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put("flow_rate", 0.5);
        coefficients.put("packet_rate", 2.0);
        ModelArtifact artifact = new ModelArtifact();
        artifact.setCoefficients(coefficients);
        artifact.setMeans(Map.of("flow_rate", 0.0, "packet_rate", 0.0));
        artifact.setStddevs(Map.of("flow_rate", 1.0, "packet_rate", 1.0));
        logistic = new RegisteredModel(new LogisticRegressionModel("lr", artifact), 1.0, Duration.ofMillis(50));

        vector = vector(Map.of("packet_rate", 2.0, "flow_rate", 2.0));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (executor != null) {
            executor.close();
        }
    }

    private Explainer explainer(RegisteredModel... models) {
        if (executor != null) {
            executor.close();
        }
        executor = new ModelExecutor(List.of(models), 2, 8);
        return new Explainer(List.of(models), settings, 0.5, clock, metrics, executor);
    }

    /**
     * Attributable model with the logistic model's answers, which waits for
     * {@link #release} before every re-evaluation and records its deadlines.
     */
    private ScoringModel delegating(ScoringModel delegate, boolean block, List<Instant> deadlines) {
        return new ScoringModel() {
            @Override
            public String getModelId() {
                return delegate.getModelId();
            }

            @Override
            public String getVersion() {
                return delegate.getVersion();
            }

            @Override
            public ModelScore score(FeatureVector vector, Instant deadline) {
                deadlines.add(deadline);
                if (block) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return delegate.score(vector, deadline);
            }

            @Override
            public boolean supportsAttribution() {
                return true;
            }

            @Override
            public Map<String, Double> baseline() {
                return delegate.baseline();
            }
        };
    }

    private FusedVerdict verdict(RegisteredModel model) {
        ModelScore score = model.getModel().score(vector, Instant.MAX);
        return new FusedVerdict(vector, score.getScore(), 1.0, List.of(score), false);
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Test
    @DisplayName("Should rank features by the score drop their occlusion causes")
    void shouldRankContributions() {
        Explanation explanation = explainer(logistic).explain(verdict(logistic));

        assertThat(explanation.isAvailable()).isTrue();
        assertThat(explanation.getEvaluations()).isEqualTo(2);
        List<FeatureContribution> contributions = explanation.getContributions();
        assertThat(contributions).extracting(FeatureContribution::getFeature)
                .containsExactly("packet_rate", "flow_rate");
        assertThat(contributions.get(0).getWeight()).isCloseTo(sigmoid(5) - sigmoid(1), within(1e-9));
        assertThat(contributions.get(1).getWeight()).isCloseTo(sigmoid(5) - sigmoid(4), within(1e-9));
        assertThat(metrics.count(MetricNames.EXPLAIN_COMPUTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Explaining the same verdict twice yields the same ordered result")
    void shouldBeStable() {
        FusedVerdict verdict = verdict(logistic);

        Explanation first = explainer(logistic).explain(verdict);
        Explanation second = explainer(logistic).explain(verdict);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should keep only the configured number of top features")
    void shouldLimitTopFeatures() {
        settings.setTopFeatures(1);

        Explanation explanation = explainer(logistic).explain(verdict(logistic));

        assertThat(explanation.getContributions()).extracting(FeatureContribution::getFeature)
                .containsExactly("packet_rate");
    }

    @Test
    @DisplayName("Should not explain verdicts below the suspicious threshold")
    void shouldSkipBenignVerdicts() {
        FusedVerdict benign = new FusedVerdict(vector, 0.2, 1.0,
                List.of(ModelScore.success("lr", null, 0.2, 1.0)), false);
        Explainer explainer = explainer(logistic);

        assertThat(explainer.isEligible(benign)).isFalse();
        assertThat(explainer.explain(benign).isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Should return an unavailable marker when the sample budget is too small")
    void shouldRespectSampleBudget() {
        settings.setSampleBudget(1);

        Explanation explanation = explainer(logistic).explain(verdict(logistic));

        assertThat(explanation.isAvailable()).isFalse();
        assertThat(explanation.getUnavailableReason()).contains("sample budget");
        assertThat(metrics.count(MetricNames.EXPLAIN_UNAVAILABLE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be unavailable when no responding model supports attribution")
    void shouldRequireAttributableModel() {
        RegisteredModel opaque = new RegisteredModel(fixed("opaque", 0.9), 1.0, Duration.ofMillis(50));
        FusedVerdict verdict = verdict(opaque);

        Explanation explanation = explainer(opaque).explain(verdict);

        assertThat(explanation.isAvailable()).isFalse();
        assertThat(explanation.getUnavailableReason()).contains("attribution");
    }

    @Test
    @DisplayName("Models that failed for the verdict are not attributed")
    void shouldSkipFailedModels() {
        FusedVerdict verdict = new FusedVerdict(vector, 0.9, 0.0,
                List.of(ModelScore.failed("lr", "timed out", 50)), true);

        assertThat(explainer(logistic).explain(verdict).isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Disabled explanations are never attempted")
    void shouldHonourDisabledSetting() {
        settings.setEnabled(false);
        Explainer explainer = explainer(logistic);
        FusedVerdict verdict = verdict(logistic);

        assertThat(explainer.isEligible(verdict)).isFalse();
        assertThat(explainer.explain(verdict).getUnavailableReason()).contains("disabled");
    }

    @Test
    @DisplayName("A slow attributable model yields an unavailable marker within the time budget")
    void shouldNotBlockOnSlowModel() {
        settings.setTimeoutMillis(100);
        RegisteredModel slow = new RegisteredModel(
                delegating(logistic.getModel(), true, new CopyOnWriteArrayList<>()), 1.0, Duration.ofMillis(50));
        FusedVerdict verdict = verdict(logistic);
        Explainer explainer = explainer(slow);

        long started = System.nanoTime();
        Explanation explanation = explainer.explain(verdict);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMillis).isLessThan(1_000);
        assertThat(explanation.isAvailable()).isFalse();
        assertThat(explanation.getUnavailableReason()).contains("time budget");
        assertThat(metrics.count(MetricNames.EXPLAIN_UNAVAILABLE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Re-evaluation deadlines are taken from the injected clock")
    void shouldUseInjectedClockForDeadlines() {
        clock = Clock.fixed(T0, ZoneOffset.UTC);
        List<Instant> deadlines = new CopyOnWriteArrayList<>();
        RegisteredModel recording = new RegisteredModel(
                delegating(logistic.getModel(), false, deadlines), 1.0, Duration.ofMillis(50));

        Explanation explanation = explainer(recording).explain(verdict(logistic));

        assertThat(explanation.isAvailable()).isTrue();
        assertThat(deadlines).hasSize(2).containsOnly(T0.plusMillis(1_000));
    }
}
