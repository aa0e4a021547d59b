package com.volforecast.engine.domain.exception;

public class InvalidObservationException extends RuntimeException {

    public InvalidObservationException(String message) {
        super(message);
    }

    public InvalidObservationException(String message, Throwable cause) {
        super(message, cause);
    }
}
