package com.volforecast.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 요청 1건에 대한 1000개 경로. paths[i][k] 는 t0 + k*increment 시점의 가격이며 k=0 은 시작가다.
 * paths[0] 은 시작가로 고정된 flat 경로. 생성 후에는 변경되지 않는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PathEnsemble {

    private final String assetId;
    private final long t0EpochMs;
    private final int incrementSeconds;
    private final int stepCount;
    private final double spotPrice;
    private final double[][] paths;

    @JsonCreator
    public PathEnsemble(@JsonProperty("assetId") String assetId,
                        @JsonProperty("t0EpochMs") long t0EpochMs,
                        @JsonProperty("incrementSeconds") int incrementSeconds,
                        @JsonProperty("stepCount") int stepCount,
                        @JsonProperty("spotPrice") double spotPrice,
                        @JsonProperty("paths") double[][] paths) {
        if (paths == null || paths.length == 0) {
            throw new IllegalArgumentException("paths must not be empty");
        }
        for (double[] path : paths) {
            if (path == null || path.length != stepCount) {
                throw new IllegalArgumentException("모든 경로 길이는 stepCount(" + stepCount + ")와 같아야 합니다");
            }
        }
        this.assetId = assetId;
        this.t0EpochMs = t0EpochMs;
        this.incrementSeconds = incrementSeconds;
        this.stepCount = stepCount;
        this.spotPrice = spotPrice;
        this.paths = deepCopy(paths);
    }

    public String getAssetId() {
        return assetId;
    }

    public long getT0EpochMs() {
        return t0EpochMs;
    }

    public int getIncrementSeconds() {
        return incrementSeconds;
    }

    public int getStepCount() {
        return stepCount;
    }

    public double getSpotPrice() {
        return spotPrice;
    }

    public double[][] getPaths() {
        return deepCopy(paths);
    }

    public int pathCount() {
        return paths.length;
    }

    public double price(int pathIndex, int step) {
        return paths[pathIndex][step];
    }

    public double[] path(int pathIndex) {
        return paths[pathIndex].clone();
    }

    public long gridEpochMs(int step) {
        return t0EpochMs + (long) step * incrementSeconds * 1000L;
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return "PathEnsemble{asset=" + assetId + ", t0=" + t0EpochMs + ", increment=" + incrementSeconds
                + ", steps=" + stepCount + ", paths=" + paths.length + "}";
    }
}
