package com.volforecast.engine.domain.model;

public enum CrpsStatus {
    SCORED,
    MISSING_REALIZED_DATA
}
