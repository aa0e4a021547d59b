package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * CRPS 결과 집계. 데이터가 없는 자산/버킷은 맵에 존재하지 않는다 (0 으로 채우지 않음).
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagnosticsReport {

    private Long windowStartEpochMs;
    private Long windowEndEpochMs;
    private long scoredCount;
    private long missingCount;

    private Map<Integer, Coverage> coverage;
    private Map<HorizonBucket, Stats> bucketStats;
    private Stats overall;
    private Map<String, Double> rollingMeanByAsset;
    private Map<String, List<DailyPoint>> dailyRollingByAsset;

    public record Coverage(double nominal, double observed, double deviation, long samples) {
    }

    public record Stats(double mean, double median, double std, long count) {
    }

    public record DailyPoint(String day, double meanCrps, long count) {
    }
}
