package com.volforecast.engine.domain.service;

import com.volforecast.engine.domain.model.AssetClass;
import com.volforecast.engine.domain.model.DistributionKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    private int pathCount = 1000;
    private int baseIntervalSeconds = 60;
    private int highFrequencyMaxIncrementSeconds = 60;
    private int significantDigits = 8;
    private int maxStepCount = 10_000;

    private double defaultLambda = 0.95;
    private double defaultDailyCap = 0.10;
    private double defaultShrinkHigh = 1.0;
    private double defaultDegreesOfFreedom = 5.0;
    private double defaultBootstrapVariance = 1e-6;
    private int minBootstrapReturns = 30;

    private Map<String, AssetProperties> assets = new LinkedHashMap<>();

    /**
     * 자산별 정적 설정. 비어 있는 값은 상위 기본값 또는 자산 클래스 기본값을 따른다.
     */
    @Getter
    @Setter
    public static class AssetProperties {

        private AssetClass assetClass = AssetClass.CRYPTO;
        private Double lambda;
        private Double dailyCap;
        private Double shrinkHigh;
        private Double degreesOfFreedom;
        private DistributionKind distribution;
        private Double bootstrapVariance;
    }
}
