package com.volforecast.engine.domain.exception;

public class PathGenerationException extends RuntimeException {

    public PathGenerationException(String message) {
        super(message);
    }

    public PathGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
