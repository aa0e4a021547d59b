package com.volforecast.engine.domain.service.governance;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.DiagnosticsReport;
import com.volforecast.engine.domain.model.DiagnosticsReport.Coverage;
import com.volforecast.engine.domain.model.DiagnosticsReport.Stats;
import com.volforecast.engine.domain.model.DistributionKind;
import com.volforecast.engine.domain.model.HorizonBucket;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningSuggestion;
import com.volforecast.engine.domain.repository.CrpsResultRepository;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import com.volforecast.engine.domain.service.evaluation.DiagnosticsAggregator;
import com.volforecast.engine.domain.service.governance.GovernanceProperties.ParameterBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 자산별 진단 결과로 파라미터 조정안을 만든다. 제안만 하며 적용은 거버넌스를 통해야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TuningAdvisor {

    static final double GOOD_CRPS = 50.0;
    static final double SHORT_CRPS_HIGH = 100.0;
    static final long SHORT_MIN_SAMPLES = 10;
    static final double LONG_CRPS_HIGH = 200.0;
    static final double COVERAGE_95_LOW = 0.93;
    static final double COVERAGE_95_HIGH = 0.97;

    private final CrpsResultRepository crpsRepository;
    private final DiagnosticsAggregator aggregator;
    private final AssetParameterRegistry registry;
    private final GovernanceProperties governanceProperties;
    private final Clock clock;

    public List<TuningSuggestion> suggest(Duration window) {
        long now = clock.millis();
        List<CrpsResult> results = crpsRepository.findByT0Between(now - window.toMillis(), now);

        List<TuningSuggestion> suggestions = new ArrayList<>();
        for (String asset : registry.assets()) {
            List<CrpsResult> assetResults = results.stream()
                    .filter(r -> asset.equals(AssetParameterRegistry.normalize(r.getAssetId())))
                    .toList();
            if (assetResults.isEmpty()) continue;
            suggestions.addAll(suggest(asset, aggregator.aggregate(assetResults, window)));
        }
        log.info("[Advisor] 조정안 생성: window={}, suggestions={}", window, suggestions.size());
        return suggestions;
    }

    public List<TuningSuggestion> suggest(String assetId, DiagnosticsReport report) {
        Stats overall = report.getOverall();
        if (overall == null || overall.mean() < GOOD_CRPS) {
            return List.of();
        }

        List<TuningSuggestion> suggestions = new ArrayList<>();
        Stats shortStats = report.getBucketStats().get(HorizonBucket.SHORT);
        if (shortStats != null && shortStats.mean() > SHORT_CRPS_HIGH && shortStats.count() >= SHORT_MIN_SAMPLES) {
            add(suggestions, assetId, TunableParameter.DECAY_LAMBDA, -0.01,
                    String.format("단기 CRPS 평균 %.2f > %.0f, 더 빠른 반응 필요", shortStats.mean(), SHORT_CRPS_HIGH));
        }

        Coverage coverage95 = report.getCoverage().get(95);
        if (coverage95 != null && registry.distributionKind(assetId) == DistributionKind.STUDENT_T) {
            if (coverage95.observed() < COVERAGE_95_LOW) {
                add(suggestions, assetId, TunableParameter.DEGREES_OF_FREEDOM, -1,
                        String.format("95%% 커버리지 %.3f < %.2f, 꼬리 두껍게", coverage95.observed(), COVERAGE_95_LOW));
            } else if (coverage95.observed() > COVERAGE_95_HIGH) {
                add(suggestions, assetId, TunableParameter.DEGREES_OF_FREEDOM, 1,
                        String.format("95%% 커버리지 %.3f > %.2f, 꼬리 얇게", coverage95.observed(), COVERAGE_95_HIGH));
            }
        }

        Stats longStats = report.getBucketStats().get(HorizonBucket.LONG);
        if (longStats != null && longStats.mean() > LONG_CRPS_HIGH) {
            add(suggestions, assetId, TunableParameter.DAILY_CAP, -0.01,
                    String.format("장기 CRPS 평균 %.2f > %.0f, 일간 상한 축소", longStats.mean(), LONG_CRPS_HIGH));
        }
        return suggestions;
    }

    private void add(List<TuningSuggestion> out, String assetId, TunableParameter parameter, double delta, String reason) {
        double current = registry.currentValue(assetId, parameter);
        ParameterBounds bounds = governanceProperties.bounds(parameter);
        double target = Math.max(bounds.getMin(), Math.min(bounds.getMax(), current + delta));
        if (Math.abs(target - current) < ParameterGovernance.STEP_TOLERANCE) return;
        out.add(new TuningSuggestion(AssetParameterRegistry.normalize(assetId), parameter, current,
                roundTo(target, 6), reason));
    }

    private static double roundTo(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
