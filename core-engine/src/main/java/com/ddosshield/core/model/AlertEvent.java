package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Alert emitted when a source changes mitigation state.
 *
 * <p>
 * Serialized to JSON and published to the alert channel. The triggering
 * verdict itself is not serialized; {@link #getVerdictReference()} identifies
 * it for the query interface.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code severity}, {@code sourceIdentity} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AlertEvent implements ShieldEvent, Serializable {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final Severity severity;
    private final SourceIdentity sourceIdentity;
    private final String summary;
    private final FusedVerdict verdict;
    private final AttackType attackType;
    private final Explanation explanation;
    private final Instant timestamp;

    private AlertEvent(Builder builder) {
        this.alertId = builder.alertId != null ? builder.alertId : UUID.randomUUID().toString();
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.sourceIdentity = Objects.requireNonNull(builder.sourceIdentity, "sourceIdentity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.summary = builder.summary;
        this.verdict = builder.verdict;
        this.attackType = builder.attackType != null ? builder.attackType : AttackType.UNKNOWN;
        this.explanation = builder.explanation;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param explanation attribution for the triggering verdict
     * @return copy of this alert carrying the explanation
     */
    public AlertEvent withExplanation(Explanation explanation) {
        return new Builder()
                .alertId(alertId)
                .severity(severity)
                .sourceIdentity(sourceIdentity)
                .summary(summary)
                .verdict(verdict)
                .attackType(attackType)
                .explanation(explanation)
                .timestamp(timestamp)
                .build();
    }

    public static class Builder {
        private String alertId;
        private Severity severity;
        private SourceIdentity sourceIdentity;
        private String summary;
        private FusedVerdict verdict;
        private AttackType attackType;
        private Explanation explanation;
        private Instant timestamp;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder sourceIdentity(SourceIdentity sourceIdentity) {
            this.sourceIdentity = sourceIdentity;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder verdict(FusedVerdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder attackType(AttackType attackType) {
            this.attackType = attackType;
            return this;
        }

        public Builder explanation(Explanation explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AlertEvent build() {
            return new AlertEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @Override
    public String getEventId() {
        return alertId;
    }

    public String getAlertId() {
        return alertId;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public SourceIdentity getSourceIdentity() {
        return sourceIdentity;
    }

    public String getSummary() {
        return summary;
    }

    @JsonIgnore
    public FusedVerdict getVerdict() {
        return verdict;
    }

    public String getVerdictReference() {
        return verdict != null ? verdict.getVerdictId() : null;
    }

    /**
     * @return fused score of the triggering verdict, or {@code null}
     */
    public Double getScore() {
        return verdict != null ? verdict.getScore() : null;
    }

    public AttackType getAttackType() {
        return attackType;
    }

    public Explanation getExplanation() {
        return explanation;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertEvent that))
            return false;
        return alertId.equals(that.alertId)
                && Objects.equals(explanation, that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, explanation);
    }

    @Override
    public String toString() {
        return "AlertEvent{" +
                severity +
                " " + sourceIdentity +
                ", attackType=" + attackType +
                ", summary='" + summary + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
