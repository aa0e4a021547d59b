package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionRecord {

    private String recordId;
    private String assetId;
    private long t0EpochMs;
    private int incrementSeconds;
    private int stepCount;
    private HorizonLabel horizonLabel;
    private PathEnsemble ensemble;
    private ParameterSnapshot parameters;
    private long loggedAtEpochMs;
    private String logReason;

    public long gridEpochMs(int step) {
        return t0EpochMs + (long) step * incrementSeconds * 1000L;
    }

    public long lastGridEpochMs() {
        return gridEpochMs(stepCount - 1);
    }
}
