package com.ddosshield.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Output of one model for one feature vector.
 *
 * <p>
 * A failed score carries {@link Double#NaN} as its score and a failure
 * reason; fusion skips it.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final String modelVersion;
    private final double score;
    private final double confidence;
    private final long latencyMillis;
    private final boolean failed;
    private final String failureReason;

    private ModelScore(String modelId, String modelVersion, double score, double confidence,
            long latencyMillis, boolean failed, String failureReason) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.modelVersion = modelVersion;
        this.score = score;
        this.confidence = confidence;
        this.latencyMillis = latencyMillis;
        this.failed = failed;
        this.failureReason = failureReason;
    }

    /**
     * @param modelId      model identifier
     * @param modelVersion artifact version; may be {@code null}
     * @param score        score in [0,1]
     * @param confidence   confidence in [0,1]
     * @return successful score
     * @throws IllegalArgumentException if score or confidence is outside [0,1]
     */
    public static ModelScore success(String modelId, String modelVersion, double score, double confidence) {
        requireUnit("score", score);
        requireUnit("confidence", confidence);
        return new ModelScore(modelId, modelVersion, score, confidence, 0L, false, null);
    }

    /**
     * @param modelId       model identifier
     * @param reason        why the model produced no score
     * @param latencyMillis time spent before giving up
     * @return failed score
     */
    public static ModelScore failed(String modelId, String reason, long latencyMillis) {
        return new ModelScore(modelId, null, Double.NaN, 0.0, latencyMillis, true,
                Objects.requireNonNull(reason, "reason must not be null"));
    }

    /**
     * @param latencyMillis measured latency
     * @return copy carrying the latency measured by the ensemble
     */
    public ModelScore withLatency(long latencyMillis) {
        return new ModelScore(modelId, modelVersion, score, confidence, latencyMillis, failed, failureReason);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
        }
    }

    public String getModelId() {
        return modelId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public boolean isFailed() {
        return failed;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelScore that))
            return false;
        return Double.compare(score, that.score) == 0
                && failed == that.failed
                && modelId.equals(that.modelId)
                && Objects.equals(modelVersion, that.modelVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, modelVersion, score, failed);
    }

    @Override
    public String toString() {
        return failed
                ? "ModelScore{" + modelId + " FAILED: " + failureReason + '}'
                : String.format("ModelScore{%s=%.3f, confidence=%.2f, %dms}",
                        modelId, score, confidence, latencyMillis);
    }
}
