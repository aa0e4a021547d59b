package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolatilityState {

    public static final int CURRENT_VERSION = 1;

    private String assetId;
    private double varianceEstimate;
    private double decayLambda;
    private long lastUpdateEpochMs;
    private long sampleCount;
    private Double lastPrice;

    @Builder.Default
    private int stateVersion = CURRENT_VERSION;

    @Override
    public String toString() {
        return "VolatilityState{asset=" + assetId + ", variance=" + varianceEstimate
                + ", lambda=" + decayLambda + ", samples=" + sampleCount + "}";
    }
}
