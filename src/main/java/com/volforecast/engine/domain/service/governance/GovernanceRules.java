package com.volforecast.engine.domain.service.governance;

import com.volforecast.engine.domain.model.GovernanceState;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 원장, 엔진 최초 기동 시각, 현재 시각만으로 (자산, 파라미터) 상태를 계산한다. 부수 효과 없음.
 * <ol>
 *   <li>해당 쌍의 마지막 변경 후 observation-period 이내: OBSERVING</li>
 *   <li>자산에 변경 이력이 없음: 기동 후 first-tuning-wait 까지 INELIGIBLE</li>
 *   <li>자산의 마지막 변경 후 min-between-tunings 까지 INELIGIBLE (min-interval 이 있으면 그 파라미터 마지막 변경 기준으로도 대기)</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class GovernanceRules {

    private final GovernanceProperties properties;

    public GovernanceState derive(List<TuningHistoryEntry> ledger,
                                  long startedAtEpochMs,
                                  long nowEpochMs,
                                  String assetId,
                                  TunableParameter parameter) {
        String asset = AssetParameterRegistry.normalize(assetId);
        Long lastOnAsset = null;
        Long lastOnPair = null;
        for (TuningHistoryEntry entry : ledger) {
            if (!asset.equals(AssetParameterRegistry.normalize(entry.getAssetId()))) continue;
            long ts = entry.getTimestampEpochMs();
            lastOnAsset = lastOnAsset == null ? ts : Math.max(lastOnAsset, ts);
            if (entry.getParameter() == parameter) {
                lastOnPair = lastOnPair == null ? ts : Math.max(lastOnPair, ts);
            }
        }

        if (lastOnPair != null) {
            long observingUntil = lastOnPair + properties.getObservationPeriod().toMillis();
            if (nowEpochMs < observingUntil) {
                return GovernanceState.observing(observingUntil);
            }
        }

        if (lastOnAsset == null) {
            long eligibleAt = startedAtEpochMs + properties.getFirstTuningWait().toMillis();
            if (nowEpochMs < eligibleAt) {
                return GovernanceState.ineligible("첫 튜닝 대기 기간 (" + format(properties.getFirstTuningWait()) + ")",
                        eligibleAt);
            }
            return GovernanceState.eligible();
        }

        long eligibleAt = lastOnAsset + properties.getMinBetweenTunings().toMillis();
        String reason = "튜닝 간 최소 간격 (" + format(properties.getMinBetweenTunings()) + ")";
        Duration minInterval = properties.bounds(parameter).getMinInterval();
        if (minInterval != null && lastOnPair != null && lastOnPair + minInterval.toMillis() > eligibleAt) {
            eligibleAt = lastOnPair + minInterval.toMillis();
            reason = parameter.getKey() + " 변경 주기 (" + format(minInterval) + ")";
        }
        if (nowEpochMs < eligibleAt) {
            return GovernanceState.ineligible(reason, eligibleAt);
        }
        return GovernanceState.eligible();
    }

    private static String format(Duration duration) {
        return duration.toDays() > 0 ? duration.toDays() + "d" : duration.toString();
    }
}
