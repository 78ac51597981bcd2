package com.ddosshield.core.error;

/**
 * Base class for per-model scoring failures. Never fatal to the pipeline:
 * the ensemble records the model as failed and fuses the rest.
 *
 * @since 1.0.0
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String modelId;

    public ModelException(String modelId, String message) {
        super("Model [" + modelId + "] " + message);
        this.modelId = modelId;
    }

    public ModelException(String modelId, String message, Throwable cause) {
        super("Model [" + modelId + "] " + message, cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
