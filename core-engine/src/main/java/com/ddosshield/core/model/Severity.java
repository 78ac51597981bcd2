package com.ddosshield.core.model;

/**
 * Alert severity.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static final double HIGH_SCORE = 0.7;
    static final double MEDIUM_SCORE = 0.4;

    /**
     * Map a fused threat score onto a severity band.
     *
     * @param score fused score in [0,1]
     * @return {@link #HIGH} at or above 0.7, {@link #MEDIUM} at or above 0.4,
     *         {@link #LOW} otherwise
     */
    public static Severity forScore(double score) {
        if (score >= HIGH_SCORE) {
            return HIGH;
        }
        if (score >= MEDIUM_SCORE) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * @param other severity to compare with
     * @return the more severe of the two
     */
    public Severity atLeast(Severity other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
