package com.ddosshield.core.error;

/**
 * Delivery of a mitigation action or alert to a downstream collaborator
 * failed. The dispatcher retries with backoff before giving up.
 *
 * @since 1.0.0
 */
public class DispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
