package com.ddosshield.core.mitigation;

import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.MitigationState;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.SourceState;

import java.util.Objects;
import java.util.Optional;

/**
 * One state change of one source, with the at most one action and at most
 * one alert it produced.
 *
 * @since 1.0.0
 */
public final class TransitionOutcome {

    private final MitigationState from;
    private final SourceState state;
    private final MitigationAction action;
    private final AlertEvent alert;

    TransitionOutcome(MitigationState from, SourceState state, MitigationAction action, AlertEvent alert) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.action = action;
        this.alert = alert;
    }

    public SourceIdentity getIdentity() {
        return state.getIdentity();
    }

    public MitigationState getFrom() {
        return from;
    }

    public MitigationState getTo() {
        return state.getState();
    }

    /** State after the transition. */
    public SourceState getState() {
        return state;
    }

    public Optional<MitigationAction> getAction() {
        return Optional.ofNullable(action);
    }

    public Optional<AlertEvent> getAlert() {
        return Optional.ofNullable(alert);
    }

    /**
     * @param alert replacement alert, e.g. one carrying an explanation
     * @return copy with the alert replaced
     */
    public TransitionOutcome withAlert(AlertEvent alert) {
        return new TransitionOutcome(from, state, action, alert);
    }

    @Override
    public String toString() {
        return "TransitionOutcome{" + getIdentity() + " " + from + " -> " + getTo()
                + (action != null ? ", action=" + action.getAction() : "")
                + (alert != null ? ", alert=" + alert.getSeverity() : "")
                + '}';
    }
}
