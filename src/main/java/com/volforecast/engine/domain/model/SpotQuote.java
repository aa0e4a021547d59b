package com.volforecast.engine.domain.model;

public record SpotQuote(String assetId, double price, long timestampEpochMs) {
}
