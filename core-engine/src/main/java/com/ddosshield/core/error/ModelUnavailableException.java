package com.ddosshield.core.error;

/**
 * A model could not produce a score (artifact problem, runtime error,
 * unusable input).
 */
public class ModelUnavailableException extends ModelException {

    private static final long serialVersionUID = 1L;

    public ModelUnavailableException(String modelId, String message) {
        super(modelId, message);
    }

    public ModelUnavailableException(String modelId, String message, Throwable cause) {
        super(modelId, message, cause);
    }
}
