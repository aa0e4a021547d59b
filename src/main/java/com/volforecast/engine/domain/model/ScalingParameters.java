package com.volforecast.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ScalingParameters {

    private final double dailyCap;
    private final double frequencyShrinkHigh;
    private final DistributionFamily distributionFamily;
    private final boolean marketHoursRequired;
}
