package com.venuepulse.common.exception;

public class InvalidParametersException extends SentimentEngineException {

    public InvalidParametersException(String message) {
        super(message);
    }
}
