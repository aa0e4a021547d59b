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
public class TuningHistoryEntry {

    private String entryId;
    private String assetId;
    private TunableParameter parameter;
    private double oldValue;
    private double newValue;
    private long timestampEpochMs;
    private String reason;
}
