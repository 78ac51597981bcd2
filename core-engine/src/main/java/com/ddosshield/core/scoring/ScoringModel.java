package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelException;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.ModelScore;

import java.time.Instant;
import java.util.Map;

/**
 * Contract for every scoring model in the ensemble.
 *
 * <p>
 * Models are stateless after construction and safe for concurrent calls:
 * the ensemble invokes them in parallel and the explainer re-invokes them
 * on perturbed copies of a vector. Concrete models are registered at
 * startup from configuration by {@link ModelFactory}.
 * </p>
 */
public interface ScoringModel {

    String getModelId();

    /**
     * @return artifact version, reported with every score
     */
    String getVersion();

    /**
     * Score one feature vector.
     *
     * @param vector   vector to score
     * @param deadline instant after which the result is no longer wanted;
     *                 long-running models should check it and give up
     * @return successful score in [0,1]
     * @throws ModelException if the model cannot produce a score
     */
    ModelScore score(FeatureVector vector, Instant deadline);

    /**
     * @return {@code true} if the explainer may attribute this model's scores
     *         by perturbing features towards {@link #baseline()}
     */
    default boolean supportsAttribution() {
        return false;
    }

    /**
     * @return reference value per feature, representing benign traffic
     */
    default Map<String, Double> baseline() {
        return Map.of();
    }
}
