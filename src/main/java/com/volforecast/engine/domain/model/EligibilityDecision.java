package com.volforecast.engine.domain.model;

public record EligibilityDecision(boolean eligible, String reason) {
}
