package com.ddosshield.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Instruction for the enforcement collaborator.
 *
 * <p>
 * Serialized as {@code {actionId, sourceIdentity, action, expiresAt?, reason,
 * verdictReference?, issuedAt}}. Emitted once per transition and never
 * mutated.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MitigationAction implements ShieldEvent, Serializable {

    private static final long serialVersionUID = 1L;

    private final String actionId;
    private final SourceIdentity sourceIdentity;
    private final ActionKind action;
    private final FusedVerdict verdict;
    private final String reason;
    private final Instant issuedAt;
    private final Instant expiresAt;

    private MitigationAction(Builder b) {
        this.actionId = b.actionId != null ? b.actionId : UUID.randomUUID().toString();
        this.sourceIdentity = Objects.requireNonNull(b.sourceIdentity, "sourceIdentity must not be null");
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.issuedAt = Objects.requireNonNull(b.issuedAt, "issuedAt must not be null");
        this.verdict = b.verdict;
        this.reason = b.reason;
        this.expiresAt = b.expiresAt;
        if (action == ActionKind.BLOCK && expiresAt == null) {
            throw new IllegalArgumentException("A block action requires expiresAt");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String actionId;
        private SourceIdentity sourceIdentity;
        private ActionKind action;
        private FusedVerdict verdict;
        private String reason;
        private Instant issuedAt;
        private Instant expiresAt;

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder sourceIdentity(SourceIdentity sourceIdentity) {
            this.sourceIdentity = sourceIdentity;
            return this;
        }

        public Builder action(ActionKind action) {
            this.action = action;
            return this;
        }

        public Builder verdict(FusedVerdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        /**
         * @return a new action
         * @throws NullPointerException     if identity, kind or issue time is
         *                                  missing
         * @throws IllegalArgumentException if a block has no expiry
         */
        public MitigationAction build() {
            return new MitigationAction(this);
        }
    }

    @Override
    public String getEventId() {
        return actionId;
    }

    public String getActionId() {
        return actionId;
    }

    @Override
    public SourceIdentity getSourceIdentity() {
        return sourceIdentity;
    }

    public ActionKind getAction() {
        return action;
    }

    /**
     * @return triggering verdict, or {@code null} for timer-driven or manual
     *         actions
     */
    @JsonIgnore
    public FusedVerdict getVerdict() {
        return verdict;
    }

    public String getVerdictReference() {
        return verdict != null ? verdict.getVerdictId() : null;
    }

    public String getReason() {
        return reason;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MitigationAction that))
            return false;
        return actionId.equals(that.actionId);
    }

    @Override
    public int hashCode() {
        return actionId.hashCode();
    }

    @Override
    public String toString() {
        return "MitigationAction{" +
                action +
                " " + sourceIdentity +
                (expiresAt != null ? " until " + expiresAt : "") +
                ", reason='" + reason + '\'' +
                ", issuedAt=" + issuedAt +
                '}';
    }
}
