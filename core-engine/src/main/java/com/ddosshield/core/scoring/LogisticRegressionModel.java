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
 * Supervised linear classifier over standardized features.
 *
 * <p>
 * {@code p = sigmoid(intercept + sum(coef[f] * (x[f] - mean[f]) / std[f]))}.
 * Features missing from the vector contribute nothing. Confidence grows
 * with the distance of {@code p} from 0.5.
 * </p>
 *
 * @since 1.0.0
 */
public class LogisticRegressionModel implements ScoringModel {

    private final String modelId;
    private final String version;
    private final double intercept;
    private final List<String> features;
    private final Map<String, Double> coefficients;
    private final Map<String, Double> means;
    private final Map<String, Double> stddevs;

    /**
     * @param modelId  registry id
     * @param artifact trained parameters
     * @throws IllegalArgumentException if the artifact has no coefficients
     */
    public LogisticRegressionModel(String modelId, ModelArtifact artifact) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (artifact.getCoefficients().isEmpty()) {
            throw new IllegalArgumentException("Logistic model '" + modelId + "' has no coefficients");
        }
        this.version = artifact.getVersion();
        this.intercept = artifact.getIntercept();
        this.features = artifact.getFeatures().isEmpty()
                ? List.copyOf(artifact.getCoefficients().keySet())
                : List.copyOf(artifact.getFeatures());
        this.coefficients = Map.copyOf(artifact.getCoefficients());
        this.means = Map.copyOf(artifact.getMeans());
        this.stddevs = Map.copyOf(artifact.getStddevs());
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
        double z = intercept;
        int present = 0;
        for (String feature : features) {
            Optional<Double> value = vector.getFeature(feature);
            if (value.isEmpty()) {
                continue;
            }
            present++;
            z += coefficients.getOrDefault(feature, 0.0) * standardize(feature, value.get());
        }
        if (present == 0) {
            throw new ModelUnavailableException(modelId,
                    "none of its " + features.size() + " features are present");
        }
        double p = 1.0 / (1.0 + Math.exp(-z));
        return ModelScore.success(modelId, version, p, Math.abs(2.0 * p - 1.0));
    }

    private double standardize(String feature, double x) {
        double std = stddevs.getOrDefault(feature, 1.0);
        return (x - means.getOrDefault(feature, 0.0)) / (std > 0 ? std : 1.0);
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
