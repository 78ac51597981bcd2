package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelUnavailableException;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.ModelScore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unsupervised anomaly detector measuring how far a window deviates from
 * the trained traffic baseline.
 *
 * <p>
 * Computes the root mean square of per-feature z-scores and maps it through
 * a logistic curve centred at {@code pivot} standard deviations:
 * {@code score = sigmoid((rms - pivot) * steepness)}. Defaults are a pivot
 * of {@value #DEFAULT_PIVOT} and a steepness of {@value #DEFAULT_STEEPNESS};
 * both can be overridden through the artifact's {@code params}.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineDeviationModel implements ScoringModel {

    static final double DEFAULT_PIVOT = 3.0;
    static final double DEFAULT_STEEPNESS = 1.5;

    /** Caps a single feature's influence on the RMS. */
    private static final double MAX_Z = 50.0;

    private final String modelId;
    private final String version;
    private final List<String> features;
    private final Map<String, Double> means;
    private final Map<String, Double> stddevs;
    private final double pivot;
    private final double steepness;

    /**
     * @param modelId  registry id
     * @param artifact baseline means and standard deviations
     * @throws IllegalArgumentException if the artifact has no means
     */
    public BaselineDeviationModel(String modelId, ModelArtifact artifact) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (artifact.getMeans().isEmpty()) {
            throw new IllegalArgumentException("Deviation model '" + modelId + "' has no baseline means");
        }
        this.version = artifact.getVersion();
        this.features = artifact.getFeatures().isEmpty()
                ? List.copyOf(artifact.getMeans().keySet())
                : List.copyOf(artifact.getFeatures());
        this.means = Map.copyOf(artifact.getMeans());
        this.stddevs = Map.copyOf(artifact.getStddevs());
        this.pivot = artifact.param("pivot", DEFAULT_PIVOT);
        this.steepness = artifact.param("steepness", DEFAULT_STEEPNESS);
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
        double sumSquares = 0.0;
        int present = 0;
        for (String feature : features) {
            Optional<Double> value = vector.getFeature(feature);
            if (value.isEmpty()) {
                continue;
            }
            present++;
            double std = stddevs.getOrDefault(feature, 1.0);
            double z = (value.get() - means.getOrDefault(feature, 0.0)) / (std > 0 ? std : 1.0);
            z = Math.min(Math.abs(z), MAX_Z);
            sumSquares += z * z;
        }
        if (present == 0) {
            throw new ModelUnavailableException(modelId,
                    "none of its " + features.size() + " baseline features are present");
        }
        double rms = Math.sqrt(sumSquares / present);
        double score = 1.0 / (1.0 + Math.exp(-(rms - pivot) * steepness));
        return ModelScore.success(modelId, version, score, (double) present / features.size());
    }

    @Override
    public boolean supportsAttribution() {
        return true;
    }

    @Override
    public Map<String, Double> baseline() {
        Map<String, Double> baseline = new LinkedHashMap<>();
        for (String feature : features) {
            baseline.put(feature, means.getOrDefault(feature, 0.0));
        }
        return Collections.unmodifiableMap(baseline);
    }
}
