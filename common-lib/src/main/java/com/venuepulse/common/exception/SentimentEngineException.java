package com.venuepulse.common.exception;

/**
 * Root of the engine's unchecked exceptions.
 */
public class SentimentEngineException extends RuntimeException {

    public SentimentEngineException(String message) {
        super(message);
    }

    public SentimentEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
