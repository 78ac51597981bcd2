package com.ddosshield.core.dispatch;

import com.ddosshield.core.model.ShieldEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of an event dropped after exhausting its delivery attempts.
 */
public final class UndeliveredEvent {

    private final ShieldEvent event;
    private final int attempts;
    private final String lastError;
    private final Instant droppedAt;

    UndeliveredEvent(ShieldEvent event, int attempts, String lastError, Instant droppedAt) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.attempts = attempts;
        this.lastError = lastError;
        this.droppedAt = Objects.requireNonNull(droppedAt, "droppedAt must not be null");
    }

    public ShieldEvent getEvent() {
        return event;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getDroppedAt() {
        return droppedAt;
    }

    @Override
    public String toString() {
        return "UndeliveredEvent{" + event.getEventId() + " for " + event.getSourceIdentity()
                + ", attempts=" + attempts + ", lastError='" + lastError + "'}";
    }
}
