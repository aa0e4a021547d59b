package com.volforecast.engine.domain.model;

public enum DistributionKind {
    STUDENT_T, GAUSSIAN
}
