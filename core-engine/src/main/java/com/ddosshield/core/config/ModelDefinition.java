package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the model registry.
 *
 * <p>
 * Supported model types:
 * </p>
 * <ul>
 * <li>{@code logistic} - supervised linear classifier over standardized
 * features</li>
 * <li>{@code deviation} - unsupervised deviation from a trained traffic
 * baseline</li>
 * <li>{@code threshold} - static limits on rate and flag features</li>
 * </ul>
 *
 * <p>
 * {@code artifact} names the pre-trained JSON artifact, either a file path
 * or a {@code classpath:} resource.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    static final List<String> SUPPORTED_TYPES = List.of("logistic", "deviation", "threshold");

    /** Unique model id used in scores, metrics and logs. */
    private String id;

    /** Model type, see class docs. */
    private String type;

    /** Fusion weight, non-negative; normalized at fusion time. */
    private double weight = 1.0;

    /** Per-call timeout. */
    private long timeoutMillis = 50;

    /** Artifact location. */
    private String artifact;

    /** Disabled models are skipped at startup. */
    private boolean enabled = true;

    /**
     * @param errors collector for every problem found
     */
    void validate(List<String> errors) {
        String label = id != null ? id : "<unnamed>";
        if (id == null || id.isBlank()) {
            errors.add("Model 'id' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Model '" + label + "' requires 'type'");
        } else if (!SUPPORTED_TYPES.contains(type)) {
            errors.add("Model '" + label + "' has unknown type '" + type
                    + "'. Supported: " + String.join(", ", SUPPORTED_TYPES));
        }
        if (!(weight >= 0.0 && weight <= 1.0)) {
            errors.add("Model '" + label + "' requires 'weight' in [0, 1], got: " + weight);
        }
        if (timeoutMillis <= 0) {
            errors.add("Model '" + label + "' requires 'timeoutMillis' > 0");
        }
        if (artifact == null || artifact.isBlank()) {
            errors.add("Model '" + label + "' requires 'artifact'");
        }
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMillis);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the model type, normalised to lowercase.
     *
     * @param type model type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public String getArtifact() {
        return artifact;
    }

    public void setArtifact(String artifact) {
        this.artifact = artifact;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelDefinition that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "ModelDefinition{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", weight=" + weight +
                ", timeoutMillis=" + timeoutMillis +
                ", artifact='" + artifact + '\'' +
                ", enabled=" + enabled +
                '}';
    }
}
