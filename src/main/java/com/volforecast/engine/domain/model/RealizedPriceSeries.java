package com.volforecast.engine.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 그리드 타임스탬프별 실현가. 조회되지 않은 시점은 비어 있다.
 */
public final class RealizedPriceSeries {

    private final String assetId;
    private final Map<Long, Double> prices;

    public RealizedPriceSeries(String assetId, Map<Long, Double> prices) {
        this.assetId = assetId;
        this.prices = Collections.unmodifiableMap(new TreeMap<>(prices));
    }

    public static RealizedPriceSeries empty(String assetId) {
        return new RealizedPriceSeries(assetId, Map.of());
    }

    public String getAssetId() {
        return assetId;
    }

    public Map<Long, Double> getPrices() {
        return prices;
    }

    public Optional<Double> priceAt(long epochMs) {
        return Optional.ofNullable(prices.get(epochMs));
    }

    public int size() {
        return prices.size();
    }
}
