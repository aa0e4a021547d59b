package com.volforecast.engine.domain.exception;

public class GovernanceRejectedException extends RuntimeException {

    public GovernanceRejectedException(String message) {
        super(message);
    }

    public GovernanceRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
