package com.ddosshield.core.scoring;

import java.time.Duration;
import java.util.Objects;

/**
 * A model together with its fusion weight and per-call timeout.
 */
public final class RegisteredModel {

    private final ScoringModel model;
    private final double weight;
    private final Duration timeout;

    /**
     * @throws IllegalArgumentException if the weight is outside [0,1] or the
     *                                  timeout is not positive
     */
    public RegisteredModel(ScoringModel model, double weight, Duration timeout) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("weight must be in [0, 1], got: " + weight);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
        }
        this.weight = weight;
    }

    public ScoringModel getModel() {
        return model;
    }

    public String getModelId() {
        return model.getModelId();
    }

    public double getWeight() {
        return weight;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return model.getModelId() + "(weight=" + weight + ", timeout=" + timeout.toMillis() + "ms)";
    }
}
