package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelException;
import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.ModelScore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.ddosshield.core.TestFixtures.fixed;
import static com.ddosshield.core.TestFixtures.model;
import static com.ddosshield.core.TestFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleScorer}.
 */
class EnsembleScorerTest {

    private static final FeatureVector VECTOR = vector(Map.of("packet_rate", 1.0));

    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicBoolean stopSpinning = new AtomicBoolean(false);
    private ModelExecutor sharedExecutor;
    private InMemoryShieldMetrics metrics;
    private EnsembleScorer scorer;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryShieldMetrics();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        stopSpinning.set(true);
        if (scorer != null) {
            scorer.close();
        }
        if (sharedExecutor != null) {
            sharedExecutor.close();
        }
    }

    private EnsembleScorer scorer(RegisteredModel... models) {
        scorer = new EnsembleScorer(List.of(models), Duration.ofMillis(250), 0.5, 100,
                Clock.systemUTC(), metrics);
        return scorer;
    }

    private static RegisteredModel registered(ScoringModel model, double weight) {
        return new RegisteredModel(model, weight, Duration.ofMillis(50));
    }

    @Test
    @DisplayName("Should fuse scores as a weighted average")
    void shouldFuseWeightedAverage() {
        scorer(registered(fixed("a", 0.9), 0.6), registered(fixed("b", 0.4), 0.4));

        FusedVerdict verdict = scorer.score(VECTOR);

        assertThat(verdict.getScore()).isCloseTo(0.70, within(1e-9));
        assertThat(verdict.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(verdict.isDegraded()).isFalse();
        assertThat(verdict.isFallback()).isFalse();
        assertThat(verdict.getModelScores()).extracting(ModelScore::getModelId).containsExactly("a", "b");
        assertThat(metrics.count(MetricNames.SCORING_VERDICTS)).isEqualTo(1);
    }

    @Test
    @DisplayName("A model with zero weight is scored but does not move the verdict")
    void shouldIgnoreZeroWeightInFusion() {
        scorer(registered(fixed("a", 0.8), 1.0), registered(fixed("shadow", 0.0), 0.0));

        FusedVerdict verdict = scorer.score(VECTOR);

        assertThat(verdict.getScore()).isCloseTo(0.8, within(1e-9));
        assertThat(verdict.getModelScores()).hasSize(2);
    }

    @Test
    @DisplayName("A hanging model times out and the rest of the ensemble decides")
    void shouldTimeOutHangingModel() {
        ScoringModel hanging = model("slow", v -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 1.0;
        });
        scorer(registered(fixed("fast", 0.3), 0.5), registered(hanging, 0.5));

        long started = System.nanoTime();
        FusedVerdict verdict = scorer.score(VECTOR);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMillis).isLessThan(2_000);
        assertThat(verdict.getScore()).isCloseTo(0.3, within(1e-9));
        assertThat(verdict.getConfidence()).isCloseTo(0.5, within(1e-9));
        assertThat(verdict.isDegraded()).isTrue();
        ModelScore slow = verdict.getModelScores().get(1);
        assertThat(slow.isFailed()).isTrue();
        assertThat(slow.getFailureReason()).contains("timed out");
        assertThat(metrics.count(MetricNames.SCORING_MODEL_TIMEOUT)).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing model is reported without failing the verdict")
    void shouldIsolateFailingModel() {
        ScoringModel broken = model("broken", v -> {
            throw new ModelException("broken", "corrupt weights");
        });
        scorer(registered(fixed("ok", 0.6), 0.5), registered(broken, 0.5));

        FusedVerdict verdict = scorer.score(VECTOR);

        assertThat(verdict.getScore()).isCloseTo(0.6, within(1e-9));
        assertThat(verdict.getModelScores().get(1).getFailureReason()).contains("corrupt weights");
        assertThat(metrics.count(MetricNames.SCORING_MODEL_FAILED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Without any history a total outage yields the neutral score")
    void shouldFallBackToNeutral() {
        scorer(registered(model("down", v -> {
            throw new IllegalStateException("down");
        }), 1.0));

        FusedVerdict verdict = scorer.score(VECTOR);

        assertThat(verdict.isFallback()).isTrue();
        assertThat(verdict.getScore()).isEqualTo(0.5);
        assertThat(verdict.getConfidence()).isZero();
        assertThat(metrics.count(MetricNames.SCORING_FALLBACK)).isEqualTo(1);
    }

    @Test
    @DisplayName("Repeated outages decay the last known score toward neutral")
    void shouldDecayTowardNeutral() {
        AtomicBoolean failing = new AtomicBoolean(false);
        scorer(registered(model("flaky", v -> {
            if (failing.get()) {
                throw new IllegalStateException("unreachable");
            }
            return 0.9;
        }), 1.0));

        assertThat(scorer.score(VECTOR).getScore()).isCloseTo(0.9, within(1e-9));
        failing.set(true);

        assertThat(scorer.score(VECTOR).getScore()).isCloseTo(0.7, within(1e-9));
        assertThat(scorer.score(VECTOR).getScore()).isCloseTo(0.6, within(1e-9));
        assertThat(scorer.score(VECTOR).getScore()).isCloseTo(0.55, within(1e-9));
        assertThat(scorer.lastKnownScore(VECTOR.getIdentity())).isCloseTo(0.55, within(1e-9));
    }

    @Test
    @DisplayName("Forgetting a source drops its last known score")
    void shouldForgetHistory() {
        scorer(registered(fixed("a", 0.9), 1.0));
        scorer.score(VECTOR);

        scorer.forget(VECTOR.getIdentity());

        assertThat(scorer.lastKnownScore(VECTOR.getIdentity())).isNull();
    }

    @Test
    @DisplayName("A model that ignores interrupts never holds more than its pool's threads")
    void shouldBoundThreadsForUninterruptibleModel() {
        ScoringModel spinning = model("spin", v -> {
            while (!stopSpinning.get()) {
                Thread.onSpinWait();
            }
            return 1.0;
        });
        RegisteredModel fast = registered(fixed("fast", 0.3), 0.5);
        RegisteredModel spin = registered(spinning, 0.5);
        sharedExecutor = new ModelExecutor(List.of(fast, spin), 2, 2);
        scorer = new EnsembleScorer(List.of(fast, spin), Duration.ofMillis(100), 0.5, 100,
                Clock.systemUTC(), metrics, sharedExecutor, false);

        for (int i = 0; i < 40; i++) {
            FusedVerdict verdict = scorer.score(VECTOR);
            assertThat(verdict.getScore()).isCloseTo(0.3, within(1e-9));
            assertThat(verdict.getModelScores().get(1).isFailed()).isTrue();
        }

        assertThat(sharedExecutor.poolSize("spin")).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("A call rejected by a saturated model pool is recorded as a failed score")
    void shouldFailScoreWhenPoolRejects() {
        ScoringModel stuck = model("stuck", v -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 1.0;
        });
        RegisteredModel registered = registered(stuck, 1.0);
        sharedExecutor = new ModelExecutor(List.of(registered), 1, 1);
        sharedExecutor.submit(stuck, VECTOR, Instant.MAX);
        sharedExecutor.submit(stuck, VECTOR, Instant.MAX);
        scorer = new EnsembleScorer(List.of(registered), Duration.ofMillis(100), 0.5, 100,
                Clock.systemUTC(), metrics, sharedExecutor, false);

        FusedVerdict verdict = scorer.score(VECTOR);

        assertThat(verdict.isFallback()).isTrue();
        assertThat(verdict.getModelScores().get(0).getFailureReason()).contains("rejected");
        assertThat(metrics.count(MetricNames.SCORING_MODEL_FAILED)).isEqualTo(1);
    }
}
