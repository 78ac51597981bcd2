package com.ddosshield.core;

import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.ModelScore;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.scoring.ScoringModel;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Shared builders for engine tests.
 */
public final class TestFixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private TestFixtures() {
        // utility class
    }

    public static FeatureVector vector(SourceIdentity identity, Instant windowEnd, Map<String, Double> features) {
        return new FeatureVector(identity, windowEnd.minusSeconds(10), windowEnd, 1, features);
    }

    public static FeatureVector vector(Map<String, Double> features) {
        return vector(SourceIdentity.of("192.0.2.10"), T0.plusSeconds(10), features);
    }

    /**
     * A verdict for {@code identity} whose window ends at {@code at}.
     */
    public static FusedVerdict verdict(SourceIdentity identity, double score, Instant at) {
        FeatureVector vector = vector(identity, at, Map.of("packet_rate", 1.0));
        return new FusedVerdict(vector, score, 1.0,
                List.of(ModelScore.success("stub", "1", score, 1.0)), false);
    }

    /**
     * Model whose answer is computed by {@code behaviour}; it may throw or
     * block to simulate failures.
     */
    public static ScoringModel model(String id, Function<FeatureVector, Double> behaviour) {
        return new ScoringModel() {
            @Override
            public String getModelId() {
                return id;
            }

            @Override
            public String getVersion() {
                return "test";
            }

            @Override
            public ModelScore score(FeatureVector vector, Instant deadline) {
                return ModelScore.success(id, "test", behaviour.apply(vector), 1.0);
            }
        };
    }

    public static ScoringModel fixed(String id, double score) {
        return model(id, v -> score);
    }

    /**
     * Poll {@code condition} until it holds or {@code timeout} elapses.
     *
     * @return the final value of the condition
     */
    public static boolean eventually(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
