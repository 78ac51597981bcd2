package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Explanation settings ({@code explain:} section).
 */
public class ExplainSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;

    /** Maximum number of model evaluations one explanation may spend. */
    private int sampleBudget = 256;

    private long timeoutMillis = 100;

    private int topFeatures = 5;

    private int cacheSize = 1024;

    void validate(List<String> errors) {
        if (sampleBudget <= 0) {
            errors.add("explain.sampleBudget must be > 0, got: " + sampleBudget);
        }
        if (timeoutMillis <= 0) {
            errors.add("explain.timeoutMillis must be > 0, got: " + timeoutMillis);
        }
        if (topFeatures <= 0) {
            errors.add("explain.topFeatures must be > 0, got: " + topFeatures);
        }
        if (cacheSize <= 0) {
            errors.add("explain.cacheSize must be > 0, got: " + cacheSize);
        }
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMillis);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getSampleBudget() {
        return sampleBudget;
    }

    public void setSampleBudget(int sampleBudget) {
        this.sampleBudget = sampleBudget;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public int getTopFeatures() {
        return topFeatures;
    }

    public void setTopFeatures(int topFeatures) {
        this.topFeatures = topFeatures;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }
}
