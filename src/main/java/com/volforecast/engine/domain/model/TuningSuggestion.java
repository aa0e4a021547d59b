package com.volforecast.engine.domain.model;

public record TuningSuggestion(String assetId,
                               TunableParameter parameter,
                               double currentValue,
                               double suggestedValue,
                               String reason) {
}
