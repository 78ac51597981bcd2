package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Ordered feature attribution for one verdict, or an explicit marker that no
 * attribution could be produced.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Explanation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String verdictId;
    private final boolean available;
    private final String unavailableReason;
    private final List<FeatureContribution> contributions;
    private final int evaluations;

    private Explanation(String verdictId, boolean available, String unavailableReason,
            List<FeatureContribution> contributions, int evaluations) {
        this.verdictId = Objects.requireNonNull(verdictId, "verdictId must not be null");
        this.available = available;
        this.unavailableReason = unavailableReason;
        this.contributions = List.copyOf(contributions);
        this.evaluations = evaluations;
    }

    /**
     * @param verdictId     explained verdict
     * @param contributions contributions, already ordered by importance
     * @param evaluations   model evaluations spent
     * @return available explanation
     */
    public static Explanation of(String verdictId, List<FeatureContribution> contributions, int evaluations) {
        return new Explanation(verdictId, true, null, contributions, evaluations);
    }

    /**
     * @param verdictId verdict that could not be explained
     * @param reason    why
     * @return unavailable marker
     */
    public static Explanation unavailable(String verdictId, String reason) {
        return new Explanation(verdictId, false, Objects.requireNonNull(reason, "reason must not be null"),
                List.of(), 0);
    }

    public String getVerdictId() {
        return verdictId;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getUnavailableReason() {
        return unavailableReason;
    }

    public List<FeatureContribution> getContributions() {
        return contributions;
    }

    public int getEvaluations() {
        return evaluations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Explanation that))
            return false;
        return available == that.available
                && verdictId.equals(that.verdictId)
                && Objects.equals(unavailableReason, that.unavailableReason)
                && contributions.equals(that.contributions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdictId, available, unavailableReason, contributions);
    }

    @Override
    public String toString() {
        return available
                ? "Explanation{" + verdictId + " " + contributions + '}'
                : "Explanation{" + verdictId + " unavailable: " + unavailableReason + '}';
    }
}
