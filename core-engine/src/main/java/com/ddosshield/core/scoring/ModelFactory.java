package com.ddosshield.core.scoring;

import com.ddosshield.core.config.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link ScoringModel} instances from
 * {@link ModelDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new model types:
 * register the new type string here and create the corresponding model.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ModelFactory.class);

    private ModelFactory() {
        // utility class
    }

    /**
     * Load the definition's artifact and build the model.
     *
     * @param definition model definition
     * @return the model
     * @throws IllegalArgumentException if the type is unknown or the artifact
     *                                  is missing or unusable
     * @throws IllegalStateException    if the artifact declares a different type
     */
    public static ScoringModel create(ModelDefinition definition) {
        Objects.requireNonNull(definition, "ModelDefinition must not be null");
        Objects.requireNonNull(definition.getType(), "Model type must not be null");

        ModelArtifact artifact = ArtifactLoader.load(definition.getArtifact());
        String type = definition.getType().toLowerCase(Locale.ROOT);
        if (artifact.getType() != null && !artifact.getType().equalsIgnoreCase(type)) {
            throw new IllegalStateException("Model '" + definition.getId() + "' is configured as '" + type
                    + "' but its artifact is of type '" + artifact.getType() + "'");
        }
        return create(definition.getId(), type, artifact);
    }

    /**
     * Build a model from an already loaded artifact.
     */
    public static ScoringModel create(String modelId, String type, ModelArtifact artifact) {
        return switch (type) {
            case "logistic" -> new LogisticRegressionModel(modelId, artifact);
            case "deviation" -> new BaselineDeviationModel(modelId, artifact);
            case "threshold" -> new RateThresholdModel(modelId, artifact);
            default -> throw new IllegalArgumentException(
                    "Unknown model type: '" + type + "'. Supported types: logistic, deviation, threshold");
        };
    }

    /**
     * Create every enabled model in the supplied list.
     *
     * @param definitions model definitions
     * @return unmodifiable list of registered models, in declaration order
     */
    public static List<RegisteredModel> createAll(List<ModelDefinition> definitions) {
        Objects.requireNonNull(definitions, "Model definitions must not be null");
        List<RegisteredModel> models = definitions.stream()
                .filter(ModelDefinition::isEnabled)
                .map(d -> new RegisteredModel(create(d), d.getWeight(), d.timeout()))
                .toList();
        LOG.info("Registered {} scoring model(s): {}", models.size(), models);
        return Collections.unmodifiableList(models);
    }
}
