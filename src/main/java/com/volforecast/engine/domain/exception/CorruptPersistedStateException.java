package com.volforecast.engine.domain.exception;

public class CorruptPersistedStateException extends RuntimeException {

    public CorruptPersistedStateException(String message) {
        super(message);
    }

    public CorruptPersistedStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
