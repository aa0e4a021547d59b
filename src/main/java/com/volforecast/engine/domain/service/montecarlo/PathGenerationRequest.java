package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.model.DistributionFamily;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PathGenerationRequest {

    private final double spotPrice;
    private final double stepSigma;
    private final int stepCount;
    private final DistributionFamily distributionFamily;
    private final long seed;

    @Builder.Default
    private final int pathCount = 1000;

    @Builder.Default
    private final boolean flatten = false;

    @Builder.Default
    private final int significantDigits = 8;
}
