package com.volforecast.engine.domain.exception;

public class InvalidScalingException extends RuntimeException {

    public InvalidScalingException(String message) {
        super(message);
    }

    public InvalidScalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
