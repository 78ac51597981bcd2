package com.ddosshield.core.model;

/**
 * Outbound event handed to the dispatcher: either a {@link MitigationAction}
 * for the enforcement collaborator or an {@link AlertEvent} for the alert
 * channel.
 */
public interface ShieldEvent {

    /**
     * @return unique id used in logs and undelivered records
     */
    String getEventId();

    /**
     * @return the source identity the event concerns
     */
    SourceIdentity getSourceIdentity();
}
