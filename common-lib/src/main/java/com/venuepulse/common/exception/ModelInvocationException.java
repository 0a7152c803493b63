package com.venuepulse.common.exception;

/**
 * Thrown by a model adapter when its model produced no usable output.
 */
public class ModelInvocationException extends SentimentEngineException {
    private final String modelName;

    public ModelInvocationException(String modelName, String message) {
        super("[" + modelName + "] " + message);
        this.modelName = modelName;
    }

    public ModelInvocationException(String modelName, String message, Throwable cause) {
        super("[" + modelName + "] " + message, cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
