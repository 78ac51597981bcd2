package com.ddosshield.core.aggregation;

import java.util.Collection;

/**
 * Shannon entropy over a discrete frequency distribution.
 */
final class Entropy {

    private static final double LN2 = Math.log(2.0);

    private Entropy() {
    }

    /**
     * @param counts occurrence count per distinct value
     * @return entropy in bits; {@code 0} for an empty or single-valued
     *         distribution
     */
    static double shannon(Collection<Long> counts) {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        if (total <= 0 || counts.size() < 2) {
            return 0.0;
        }
        double entropy = 0.0;
        for (long c : counts) {
            if (c > 0) {
                double p = (double) c / total;
                entropy -= p * Math.log(p);
            }
        }
        return entropy / LN2;
    }
}
