package com.venuepulse.common.exception;

/**
 * The adapter cannot reach its model at all, for example because no endpoint is configured.
 */
public class ModelUnavailableException extends ModelInvocationException {

    public ModelUnavailableException(String modelName, String message) {
        super(modelName, message);
    }
}
