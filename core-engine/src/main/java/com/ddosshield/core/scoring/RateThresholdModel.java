package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelUnavailableException;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.ModelScore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static-limit heuristic over rate and flag features.
 *
 * <p>
 * For each configured limit the ratio {@code r = value / limit} maps to
 * {@code r^2 / (1 + r^2)}: 0.5 exactly at the limit, approaching 1 far above
 * it. The model score is the maximum over all limits. Not attributable:
 * the maximum makes single-feature perturbation meaningless.
 * </p>
 */
public class RateThresholdModel implements ScoringModel {

    private final String modelId;
    private final String version;
    private final Map<String, Double> limits;

    /**
     * @param modelId  registry id
     * @param artifact artifact carrying {@code thresholds}
     * @throws IllegalArgumentException if no thresholds are defined or a limit
     *                                  is not positive
     */
    public RateThresholdModel(String modelId, ModelArtifact artifact) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (artifact.getThresholds().isEmpty()) {
            throw new IllegalArgumentException("Threshold model '" + modelId + "' has no thresholds");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        artifact.getThresholds().forEach((feature, limit) -> {
            if (limit == null || !(limit > 0)) {
                throw new IllegalArgumentException("Threshold model '" + modelId
                        + "' requires a positive limit for '" + feature + "', got: " + limit);
            }
            copy.put(feature, limit);
        });
        this.version = artifact.getVersion();
        this.limits = copy;
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public ModelScore score(FeatureVector vector, Instant deadline) {
        double max = 0.0;
        int present = 0;
        for (Map.Entry<String, Double> limit : limits.entrySet()) {
            Optional<Double> value = vector.getFeature(limit.getKey());
            if (value.isEmpty()) {
                continue;
            }
            present++;
            double r = Math.max(0.0, value.get()) / limit.getValue();
            double r2 = r * r;
            max = Math.max(max, Double.isInfinite(r2) ? 1.0 : r2 / (1.0 + r2));
        }
        if (present == 0) {
            throw new ModelUnavailableException(modelId, "no thresholded feature is present");
        }
        return ModelScore.success(modelId, version, max, (double) present / limits.size());
    }
}
