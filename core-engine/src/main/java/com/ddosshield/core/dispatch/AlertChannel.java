package com.ddosshield.core.dispatch;

import com.ddosshield.core.error.DispatchException;
import com.ddosshield.core.model.AlertEvent;

/**
 * Outbound interface to the notification collaborator.
 */
@FunctionalInterface
public interface AlertChannel {

    /**
     * @param alert alert to publish
     * @throws DispatchException if delivery failed; the dispatcher retries
     */
    void publish(AlertEvent alert);
}
