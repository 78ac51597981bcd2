package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Event dispatch settings ({@code dispatch:} section).
 */
public class DispatchSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxAttempts = 5;
    private long initialBackoffMillis = 200;
    private long maxBackoffMillis = 5000;
    private int undeliveredCapacity = 1000;

    void validate(List<String> errors) {
        if (maxAttempts < 1) {
            errors.add("dispatch.maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoffMillis <= 0) {
            errors.add("dispatch.initialBackoffMillis must be > 0, got: " + initialBackoffMillis);
        }
        if (maxBackoffMillis < initialBackoffMillis) {
            errors.add("dispatch.maxBackoffMillis must be >= initialBackoffMillis");
        }
        if (undeliveredCapacity <= 0) {
            errors.add("dispatch.undeliveredCapacity must be > 0, got: " + undeliveredCapacity);
        }
    }

    /**
     * Backoff before the given retry, doubling from the initial backoff.
     *
     * @param attempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration backoffAfter(int attempt) {
        long delay = initialBackoffMillis;
        for (int i = 1; i < attempt && delay < maxBackoffMillis; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, maxBackoffMillis));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
        this.initialBackoffMillis = initialBackoffMillis;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public void setMaxBackoffMillis(long maxBackoffMillis) {
        this.maxBackoffMillis = maxBackoffMillis;
    }

    public int getUndeliveredCapacity() {
        return undeliveredCapacity;
    }

    public void setUndeliveredCapacity(int undeliveredCapacity) {
        this.undeliveredCapacity = undeliveredCapacity;
    }
}
