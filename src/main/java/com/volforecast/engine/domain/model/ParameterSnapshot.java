package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 앙상블 생성 시점에 사용된 파라미터. 예측 기록과 함께 보관되어 재평가 시 그대로 참조된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterSnapshot {

    private DistributionKind distributionKind;
    private double degreesOfFreedom;
    private double decayLambda;
    private double dailyCap;
    private double frequencyShrinkHigh;
    private HorizonLabel horizonLabel;
    private double stepSigma;
    private boolean flattened;
    private long seed;
    private double varianceEstimate;
}
