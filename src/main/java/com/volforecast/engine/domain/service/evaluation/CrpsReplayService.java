package com.volforecast.engine.domain.service.evaluation;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.PredictionRecord;
import com.volforecast.engine.domain.model.RealizedPriceSeries;
import com.volforecast.engine.domain.repository.CrpsResultRepository;
import com.volforecast.engine.domain.repository.PredictionRecordRepository;
import com.volforecast.engine.domain.service.marketdata.MarketDataGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 보관된 예측 중 그리드가 모두 지난 것을 채점해 결과를 추가한다. 이미 채점된 recordId 는 다시 채점하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrpsReplayService {

    private final PredictionRecordRepository predictionRepository;
    private final CrpsResultRepository crpsRepository;
    private final MarketDataGateway marketDataGateway;
    private final CrpsEvaluator evaluator;
    private final ReplayProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${forecast.replay.interval-ms:300000}")
    public void scheduledReplay() {
        if (!properties.isEnabled()) return;
        replay();
    }

    public synchronized ReplaySummary replay() {
        long now = clock.millis();
        long from = now - properties.getLookback().toMillis();
        long settleMs = properties.getSettleDelay().toMillis();

        List<PredictionRecord> records = predictionRepository.findByT0Between(from, now);
        Set<String> alreadyScored = crpsRepository.findScoredRecordIds(from, now);

        int scored = 0;
        int pending = 0;
        int failed = 0;
        for (PredictionRecord record : records) {
            if (alreadyScored.contains(record.getRecordId())) continue;
            if (record.lastGridEpochMs() + settleMs > now) {
                pending++;
                continue;
            }
            try {
                List<CrpsResult> results = scoreRecord(record);
                crpsRepository.appendAll(results);
                scored++;
            } catch (RuntimeException e) {
                failed++;
                log.error("[CRPS] 재채점 실패: recordId={}, asset={}", record.getRecordId(), record.getAssetId(), e);
            }
        }

        ReplaySummary summary = new ReplaySummary(records.size(), scored, pending, failed);
        log.info("[CRPS] 재채점 완료: candidates={}, scored={}, pending={}, failed={}",
                summary.candidates(), scored, pending, failed);
        return summary;
    }

    private List<CrpsResult> scoreRecord(PredictionRecord record) {
        List<Long> grid = new ArrayList<>(record.getStepCount());
        for (int k = 0; k < record.getStepCount(); k++) {
            grid.add(record.gridEpochMs(k));
        }
        RealizedPriceSeries realized = marketDataGateway.getRealized(record.getAssetId(), grid);
        return evaluator.score(record, realized);
    }

    public record ReplaySummary(int candidates, int scored, int pending, int failed) {
    }
}
