package com.ddosshield.core.dispatch;

import com.ddosshield.core.model.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel that only logs alerts.
 */
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertChannel.class);

    @Override
    public void publish(AlertEvent alert) {
        LOG.info("ALERT [{}] {} {}", alert.getSeverity(), alert.getSourceIdentity(), alert.getSummary());
    }
}
