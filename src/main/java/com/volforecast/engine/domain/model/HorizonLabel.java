package com.volforecast.engine.domain.model;

public enum HorizonLabel {

    HIGH, LOW;

    public static HorizonLabel forIncrement(int incrementSeconds, int highFrequencyMaxIncrementSeconds) {
        return incrementSeconds <= highFrequencyMaxIncrementSeconds ? HIGH : LOW;
    }
}
