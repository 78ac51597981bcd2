package com.ddosshield.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Signed share of a fused score attributed to one feature. Positive values
 * pushed the score up.
 */
public final class FeatureContribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String feature;
    private final double weight;

    public FeatureContribution(String feature, double weight) {
        this.feature = Objects.requireNonNull(feature, "feature must not be null");
        this.weight = weight;
    }

    public String getFeature() {
        return feature;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureContribution that))
            return false;
        return Double.compare(weight, that.weight) == 0 && feature.equals(that.feature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, weight);
    }

    @Override
    public String toString() {
        return String.format("%s=%+.4f", feature, weight);
    }
}
