package com.volforecast.engine.domain.service;

import com.volforecast.engine.domain.model.AssetClass;
import com.volforecast.engine.domain.model.DistributionFamily;
import com.volforecast.engine.domain.model.DistributionKind;
import com.volforecast.engine.domain.model.ScalingParameters;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.repository.TuningLedgerRepository;
import com.volforecast.engine.domain.service.ForecastProperties.AssetProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 자산별 파라미터의 단일 조회 지점. 설정 파일의 정적 프로파일 위에 거버넌스 원장의 변경분을 덮어쓴다.
 */
@Slf4j
@Component
public class AssetParameterRegistry {

    private final ForecastProperties properties;
    private final TuningLedgerRepository ledgerRepository;

    private final Map<String, AssetProperties> profiles = new LinkedHashMap<>();
    private final Map<String, Map<TunableParameter, Double>> overrides = new ConcurrentHashMap<>();

    public AssetParameterRegistry(ForecastProperties properties, TuningLedgerRepository ledgerRepository) {
        this.properties = properties;
        this.ledgerRepository = ledgerRepository;
        properties.getAssets().forEach((asset, profile) -> profiles.put(normalize(asset), profile));
    }

    @PostConstruct
    public void replayLedger() {
        List<TuningHistoryEntry> entries = ledgerRepository.findAll();
        for (TuningHistoryEntry entry : entries) {
            String asset = normalize(entry.getAssetId());
            if (!profiles.containsKey(asset)) {
                log.warn("[Registry] 원장에 미등록 자산 변경 기록, 무시: asset={}, parameter={}",
                        asset, entry.getParameter());
                continue;
            }
            overrides.computeIfAbsent(asset, k -> new ConcurrentHashMap<>())
                    .put(entry.getParameter(), entry.getNewValue());
        }
        log.info("[Registry] 자산 프로파일 로드: assets={}, 원장 재생={}건", profiles.keySet(), entries.size());
    }

    public Set<String> assets() {
        return profiles.keySet();
    }

    public AssetProperties profile(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("자산 ID가 비어 있습니다");
        }
        AssetProperties profile = profiles.get(normalize(assetId));
        if (profile == null) {
            throw new IllegalArgumentException("등록되지 않은 자산: " + assetId);
        }
        return profile;
    }

    public AssetClass assetClass(String assetId) {
        AssetClass assetClass = profile(assetId).getAssetClass();
        return assetClass != null ? assetClass : AssetClass.CRYPTO;
    }

    public double currentValue(String assetId, TunableParameter parameter) {
        AssetProperties profile = profile(assetId);
        Map<TunableParameter, Double> assetOverrides = overrides.get(normalize(assetId));
        if (assetOverrides != null) {
            Double overridden = assetOverrides.get(parameter);
            if (overridden != null) return overridden;
        }
        return switch (parameter) {
            case DECAY_LAMBDA -> orDefault(profile.getLambda(), properties.getDefaultLambda());
            case DEGREES_OF_FREEDOM -> orDefault(profile.getDegreesOfFreedom(), properties.getDefaultDegreesOfFreedom());
            case DAILY_CAP -> orDefault(profile.getDailyCap(), properties.getDefaultDailyCap());
        };
    }

    public double decayLambda(String assetId) {
        return currentValue(assetId, TunableParameter.DECAY_LAMBDA);
    }

    public double bootstrapVariance(String assetId) {
        return orDefault(profile(assetId).getBootstrapVariance(), properties.getDefaultBootstrapVariance());
    }

    public DistributionKind distributionKind(String assetId) {
        DistributionKind kind = profile(assetId).getDistribution();
        return kind != null ? kind : assetClass(assetId).getDefaultDistribution();
    }

    public ScalingParameters scalingParameters(String assetId) {
        AssetProperties profile = profile(assetId);
        DistributionFamily family = distributionKind(assetId) == DistributionKind.GAUSSIAN
                ? DistributionFamily.gaussian()
                : DistributionFamily.studentT(currentValue(assetId, TunableParameter.DEGREES_OF_FREEDOM));

        return ScalingParameters.builder()
                .dailyCap(currentValue(assetId, TunableParameter.DAILY_CAP))
                .frequencyShrinkHigh(orDefault(profile.getShrinkHigh(), properties.getDefaultShrinkHigh()))
                .distributionFamily(family)
                .marketHoursRequired(assetClass(assetId).isMarketHoursRequired())
                .build();
    }

    /** asset -> parameter key -> value, 자산/키 이름순. */
    public Map<String, Map<String, Double>> currentValues() {
        Map<String, Map<String, Double>> values = new TreeMap<>();
        for (String asset : profiles.keySet()) {
            Map<String, Double> perAsset = new TreeMap<>();
            for (TunableParameter parameter : TunableParameter.values()) {
                perAsset.put(parameter.getKey(), currentValue(asset, parameter));
            }
            values.put(asset, perAsset);
        }
        return values;
    }

    public void applyOverride(String assetId, TunableParameter parameter, double value) {
        String asset = normalize(assetId);
        profile(asset);
        overrides.computeIfAbsent(asset, k -> new ConcurrentHashMap<>()).put(parameter, value);
        log.info("[Registry] 파라미터 반영: asset={}, parameter={}, value={}", asset, parameter.getKey(), value);
    }

    public static String normalize(String assetId) {
        return assetId == null ? null : assetId.trim().toUpperCase();
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
