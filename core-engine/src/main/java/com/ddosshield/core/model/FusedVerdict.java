package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Combined threat score for one feature vector.
 *
 * <p>
 * Every contributing {@link ModelScore} was computed on the same
 * {@link FeatureVector}, which the verdict keeps for attribution. The
 * verdict's {@link #getTimestamp() timestamp} is the window end, so decisions
 * follow event time rather than scoring latency.
 * </p>
 *
 * @since 1.0.0
 */
public final class FusedVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FeatureVector vector;
    private final double score;
    private final double confidence;
    private final List<ModelScore> modelScores;
    private final boolean fallback;

    /**
     * @param vector      the scored vector; must not be {@code null}
     * @param score       fused score in [0,1]
     * @param confidence  share of configured weight that actually responded
     * @param modelScores one entry per configured model, failed ones included
     * @param fallback    {@code true} if no model responded and the score was
     *                    derived from the last known score
     */
    public FusedVerdict(FeatureVector vector, double score, double confidence,
            List<ModelScore> modelScores, boolean fallback) {
        this.vector = Objects.requireNonNull(vector, "vector must not be null");
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("Fused score must be in [0, 1], got: " + score);
        }
        this.score = score;
        this.confidence = confidence;
        this.modelScores = List.copyOf(Objects.requireNonNull(modelScores, "modelScores must not be null"));
        this.fallback = fallback;
    }

    /**
     * @return identifier of the underlying vector
     */
    public String getVerdictId() {
        return vector.getVectorId();
    }

    public SourceIdentity getIdentity() {
        return vector.getIdentity();
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<ModelScore> getModelScores() {
        return modelScores;
    }

    public Instant getTimestamp() {
        return vector.getWindowEnd();
    }

    public boolean isFallback() {
        return fallback;
    }

    /**
     * @return {@code true} if at least one model failed
     */
    public boolean isDegraded() {
        return modelScores.stream().anyMatch(ModelScore::isFailed);
    }

    @JsonIgnore
    public FeatureVector getVector() {
        return vector;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FusedVerdict that))
            return false;
        return Double.compare(score, that.score) == 0
                && fallback == that.fallback
                && vector.equals(that.vector)
                && modelScores.equals(that.modelScores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vector, score, modelScores, fallback);
    }

    @Override
    public String toString() {
        return String.format("FusedVerdict{%s score=%.3f confidence=%.2f%s%s}",
                getVerdictId(), score, confidence,
                isDegraded() ? " degraded" : "",
                fallback ? " fallback" : "");
    }
}
