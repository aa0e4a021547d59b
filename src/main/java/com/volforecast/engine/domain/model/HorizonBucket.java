package com.volforecast.engine.domain.model;

public enum HorizonBucket {

    SHORT, MEDIUM, LONG;

    static final long SHORT_MAX_SECONDS = 5 * 60;
    static final long MEDIUM_MAX_SECONDS = 60 * 60;

    public static HorizonBucket ofElapsedSeconds(long elapsedSeconds) {
        if (elapsedSeconds <= SHORT_MAX_SECONDS) return SHORT;
        if (elapsedSeconds <= MEDIUM_MAX_SECONDS) return MEDIUM;
        return LONG;
    }
}
