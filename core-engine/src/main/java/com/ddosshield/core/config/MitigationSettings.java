package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Mitigation state machine settings ({@code mitigation:} section).
 *
 * <pre>
 * mitigation:
 *   suspiciousThreshold: 0.5
 *   blockThreshold: 0.8
 *   blockConfirmations: 2     # N consecutive verdicts at or above blockThreshold
 *   clearConfirmations: 3     # M consecutive verdicts below suspiciousThreshold
 *   blockDurationSeconds: 60
 *   backoffMultiplier: 2.0
 *   maxBlockDurationSeconds: 3600
 *   probationSeconds: 120
 *   idleTimeoutSeconds: 600
 * </pre>
 *
 * @since 1.0.0
 */
public class MitigationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double suspiciousThreshold = 0.5;
    private double blockThreshold = 0.8;
    private int blockConfirmations = 2;
    private int clearConfirmations = 3;
    private long blockDurationSeconds = 60;
    private double backoffMultiplier = 2.0;
    private long maxBlockDurationSeconds = 3600;
    private long probationSeconds = 120;
    private long idleTimeoutSeconds = 600;
    private int maxTrackedSources = 100_000;
    private int shards = 16;

    void validate(List<String> errors) {
        if (!(suspiciousThreshold >= 0.0 && suspiciousThreshold <= 1.0)) {
            errors.add("mitigation.suspiciousThreshold must be in [0, 1], got: " + suspiciousThreshold);
        }
        if (!(blockThreshold >= 0.0 && blockThreshold <= 1.0)) {
            errors.add("mitigation.blockThreshold must be in [0, 1], got: " + blockThreshold);
        }
        if (suspiciousThreshold >= blockThreshold) {
            errors.add("mitigation.suspiciousThreshold (" + suspiciousThreshold
                    + ") must be below mitigation.blockThreshold (" + blockThreshold + ")");
        }
        if (blockConfirmations < 1) {
            errors.add("mitigation.blockConfirmations must be >= 1, got: " + blockConfirmations);
        }
        if (clearConfirmations < 1) {
            errors.add("mitigation.clearConfirmations must be >= 1, got: " + clearConfirmations);
        }
        if (blockDurationSeconds <= 0) {
            errors.add("mitigation.blockDurationSeconds must be > 0, got: " + blockDurationSeconds);
        }
        if (backoffMultiplier < 1.0) {
            errors.add("mitigation.backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
        }
        if (maxBlockDurationSeconds < blockDurationSeconds) {
            errors.add("mitigation.maxBlockDurationSeconds must be >= blockDurationSeconds");
        }
        if (probationSeconds <= 0) {
            errors.add("mitigation.probationSeconds must be > 0, got: " + probationSeconds);
        }
        if (idleTimeoutSeconds <= 0) {
            errors.add("mitigation.idleTimeoutSeconds must be > 0, got: " + idleTimeoutSeconds);
        }
        if (maxTrackedSources <= 0) {
            errors.add("mitigation.maxTrackedSources must be > 0, got: " + maxTrackedSources);
        }
        if (shards <= 0) {
            errors.add("mitigation.shards must be > 0, got: " + shards);
        }
    }

    public Duration blockDuration() {
        return Duration.ofSeconds(blockDurationSeconds);
    }

    public Duration maxBlockDuration() {
        return Duration.ofSeconds(maxBlockDurationSeconds);
    }

    public Duration probation() {
        return Duration.ofSeconds(probationSeconds);
    }

    public Duration idleTimeout() {
        return Duration.ofSeconds(idleTimeoutSeconds);
    }

    /**
     * Block duration for a given relapse level, capped at
     * {@link #maxBlockDuration()}.
     *
     * @param relapseLevel number of relapses since the source was last
     *                     observing; 0 for a first block
     * @return escalated duration
     */
    public Duration blockDurationFor(int relapseLevel) {
        double seconds = blockDurationSeconds * Math.pow(backoffMultiplier, Math.max(0, relapseLevel));
        long capped = (long) Math.min(seconds, (double) maxBlockDurationSeconds);
        return Duration.ofSeconds(capped);
    }

    public double getSuspiciousThreshold() {
        return suspiciousThreshold;
    }

    public void setSuspiciousThreshold(double suspiciousThreshold) {
        this.suspiciousThreshold = suspiciousThreshold;
    }

    public double getBlockThreshold() {
        return blockThreshold;
    }

    public void setBlockThreshold(double blockThreshold) {
        this.blockThreshold = blockThreshold;
    }

    public int getBlockConfirmations() {
        return blockConfirmations;
    }

    public void setBlockConfirmations(int blockConfirmations) {
        this.blockConfirmations = blockConfirmations;
    }

    public int getClearConfirmations() {
        return clearConfirmations;
    }

    public void setClearConfirmations(int clearConfirmations) {
        this.clearConfirmations = clearConfirmations;
    }

    public long getBlockDurationSeconds() {
        return blockDurationSeconds;
    }

    public void setBlockDurationSeconds(long blockDurationSeconds) {
        this.blockDurationSeconds = blockDurationSeconds;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBlockDurationSeconds() {
        return maxBlockDurationSeconds;
    }

    public void setMaxBlockDurationSeconds(long maxBlockDurationSeconds) {
        this.maxBlockDurationSeconds = maxBlockDurationSeconds;
    }

    public long getProbationSeconds() {
        return probationSeconds;
    }

    public void setProbationSeconds(long probationSeconds) {
        this.probationSeconds = probationSeconds;
    }

    public long getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public void setIdleTimeoutSeconds(long idleTimeoutSeconds) {
        this.idleTimeoutSeconds = idleTimeoutSeconds;
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

    @Override
    public String toString() {
        return "MitigationSettings{" +
                "suspiciousThreshold=" + suspiciousThreshold +
                ", blockThreshold=" + blockThreshold +
                ", blockConfirmations=" + blockConfirmations +
                ", clearConfirmations=" + clearConfirmations +
                ", blockDurationSeconds=" + blockDurationSeconds +
                ", probationSeconds=" + probationSeconds +
                '}';
    }
}
