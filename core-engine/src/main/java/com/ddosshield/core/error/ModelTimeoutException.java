package com.ddosshield.core.error;

/**
 * A model did not answer within its configured timeout.
 */
public class ModelTimeoutException extends ModelException {

    private static final long serialVersionUID = 1L;

    public ModelTimeoutException(String modelId, long timeoutMillis) {
        super(modelId, "timed out after " + timeoutMillis + " ms");
    }
}
