package com.ddosshield.core.dispatch;

import com.ddosshield.core.error.DispatchException;
import com.ddosshield.core.model.MitigationAction;

/**
 * Outbound interface to the firewall or enforcement collaborator.
 *
 * <p>
 * Receives {@code block} and {@code unblock} actions only, in issue order
 * per source identity.
 * </p>
 */
@FunctionalInterface
public interface EnforcementGateway {

    /**
     * @param action action to enforce
     * @throws DispatchException if the collaborator could not be reached or
     *                           rejected the action; the dispatcher retries
     */
    void enforce(MitigationAction action);
}
