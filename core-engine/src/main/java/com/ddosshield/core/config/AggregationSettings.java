package com.ddosshield.core.config;

import com.ddosshield.core.model.IdentityGranularity;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Feature aggregation settings ({@code aggregation:} section).
 */
public class AggregationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int windowSeconds = 10;
    private int maxTrackedSources = 100_000;
    private int shards = 16;
    private int maxDistinctPorts = 4096;
    private String identityGranularity = "address";

    void validate(List<String> errors) {
        if (windowSeconds <= 0) {
            errors.add("aggregation.windowSeconds must be > 0, got: " + windowSeconds);
        }
        if (maxTrackedSources <= 0) {
            errors.add("aggregation.maxTrackedSources must be > 0, got: " + maxTrackedSources);
        }
        if (shards <= 0) {
            errors.add("aggregation.shards must be > 0, got: " + shards);
        }
        if (maxDistinctPorts <= 0) {
            errors.add("aggregation.maxDistinctPorts must be > 0, got: " + maxDistinctPorts);
        }
        try {
            IdentityGranularity.fromString(identityGranularity);
        } catch (IllegalArgumentException e) {
            errors.add("aggregation." + e.getMessage());
        }
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    public IdentityGranularity granularity() {
        return IdentityGranularity.fromString(identityGranularity);
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getMaxTrackedSources() {
        return maxTrackedSources;
    }

    public void setMaxTrackedSources(int maxTrackedSources) {
        this.maxTrackedSources = maxTrackedSources;
    }

    public int getShards() {
        return shards;
    }

    public void setShards(int shards) {
        this.shards = shards;
    }

    public int getMaxDistinctPorts() {
        return maxDistinctPorts;
    }

    public void setMaxDistinctPorts(int maxDistinctPorts) {
        this.maxDistinctPorts = maxDistinctPorts;
    }

    public String getIdentityGranularity() {
        return identityGranularity;
    }

    public void setIdentityGranularity(String identityGranularity) {
        this.identityGranularity = identityGranularity;
    }

    @Override
    public String toString() {
        return "AggregationSettings{" +
                "windowSeconds=" + windowSeconds +
                ", maxTrackedSources=" + maxTrackedSources +
                ", shards=" + shards +
                ", identityGranularity='" + identityGranularity + '\'' +
                '}';
    }
}
