package com.ddosshield.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Numeric summary of one source identity's behaviour over one aggregation
 * window.
 *
 * <p>
 * Created by the aggregator when a window closes and never mutated
 * afterwards. Windows of one identity are disjoint and ordered by
 * {@link #getWindowStart()}. {@link #withFeature(String, double)} returns a
 * modified copy, which is how attribution perturbs inputs.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SourceIdentity identity;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final long eventCount;
    private final Map<String, Double> features;

    /**
     * @param identity    source identity; must not be {@code null}
     * @param windowStart inclusive window start; must not be {@code null}
     * @param windowEnd   exclusive window end; must be after the start
     * @param eventCount  number of flow events folded into the window
     * @param features    named features in presentation order
     * @throws IllegalArgumentException if the window is empty or a feature is
     *                                  not finite
     */
    public FeatureVector(SourceIdentity identity, Instant windowStart, Instant windowEnd,
            long eventCount, Map<String, Double> features) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (!windowEnd.isAfter(windowStart)) {
            throw new IllegalArgumentException(
                    "windowEnd must be after windowStart: " + windowStart + " .. " + windowEnd);
        }
        this.eventCount = eventCount;
        Objects.requireNonNull(features, "features must not be null");
        Map<String, Double> copy = new LinkedHashMap<>();
        features.forEach((name, value) -> {
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("Feature '" + name + "' is not finite: " + value);
            }
            copy.put(name, value);
        });
        this.features = Collections.unmodifiableMap(copy);
    }

    /**
     * @return stable identifier, {@code <identity>@<windowStartMillis>}
     */
    public String getVectorId() {
        return identity.key() + "@" + windowStart.toEpochMilli();
    }

    public SourceIdentity getIdentity() {
        return identity;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public long getEventCount() {
        return eventCount;
    }

    /**
     * @return unmodifiable, ordered map of feature name to value
     */
    public Map<String, Double> getFeatures() {
        return features;
    }

    /**
     * @return feature names in vector order
     */
    public List<String> featureNames() {
        return List.copyOf(features.keySet());
    }

    /**
     * @param name feature name
     * @return the value, or empty if the vector does not carry it
     */
    public Optional<Double> getFeature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    /**
     * @param name     feature name
     * @param fallback value returned when the feature is absent
     * @return the value or {@code fallback}
     */
    public double valueOr(String name, double fallback) {
        Double v = features.get(name);
        return v != null ? v : fallback;
    }

    /**
     * @param name  feature to replace or add
     * @param value new value
     * @return a copy with the feature set to {@code value}
     */
    public FeatureVector withFeature(String name, double value) {
        Map<String, Double> copy = new LinkedHashMap<>(features);
        copy.put(Objects.requireNonNull(name, "name must not be null"), value);
        return new FeatureVector(identity, windowStart, windowEnd, eventCount, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return eventCount == that.eventCount
                && identity.equals(that.identity)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd)
                && features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, windowStart, windowEnd, eventCount, features);
    }

    @Override
    public String toString() {
        return "FeatureVector{" +
                "identity=" + identity +
                ", window=" + windowStart + ".." + windowEnd +
                ", events=" + eventCount +
                ", features=" + features +
                '}';
    }
}
