package com.ddosshield.core.dispatch;

import com.ddosshield.core.model.MitigationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway that only logs actions. Default for standalone runs without an
 * enforcement point.
 */
public class LoggingEnforcementGateway implements EnforcementGateway {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingEnforcementGateway.class);

    @Override
    public void enforce(MitigationAction action) {
        LOG.info("ENFORCE {} {} expiresAt={} reason='{}'", action.getAction(), action.getSourceIdentity(),
                action.getExpiresAt(), action.getReason());
    }
}
