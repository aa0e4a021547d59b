package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 그리드 한 점의 채점 결과. MISSING_REALIZED_DATA 이면 crps 이하 수치 필드는 null.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrpsResult {

    private String recordId;
    private String assetId;
    private long t0EpochMs;
    private int stepIndex;
    private long gridEpochMs;
    private long elapsedSeconds;
    private HorizonBucket horizonBucket;
    private CrpsStatus status;

    private Double crps;
    private Double realizedPrice;
    private Double flatPathGap;
    private Double p5;
    private Double p50;
    private Double p95;

    public boolean isScored() {
        return status == CrpsStatus.SCORED;
    }
}
