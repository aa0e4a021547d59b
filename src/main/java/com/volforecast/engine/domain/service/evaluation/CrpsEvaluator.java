package com.volforecast.engine.domain.service.evaluation;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.CrpsStatus;
import com.volforecast.engine.domain.model.HorizonBucket;
import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.model.PredictionRecord;
import com.volforecast.engine.domain.model.RealizedPriceSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 보관된 앙상블을 실현가로 채점한다. 앙상블을 다시 생성하지 않으며, 경로 0(flat)은 채점에서 제외한다.
 * <p>
 * CRPS = mean_i |X_i - y| - 0.5 * mean_{i,j} |X_i - X_j|
 * <br>
 * 쌍 합은 정렬 후 sum_{i,j} |X_i - X_j| = 2 * sum_k (2k - n + 1) x_(k) 로 계산하며, 합산 순서가 고정되어 재실행 결과가 비트 단위로 같다.
 */
@Slf4j
@Component
public class CrpsEvaluator {

    public List<CrpsResult> score(PredictionRecord record, RealizedPriceSeries realized) {
        PathEnsemble ensemble = record.getEnsemble();
        if (ensemble == null) {
            throw new IllegalArgumentException("앙상블이 없는 기록입니다: recordId=" + record.getRecordId());
        }
        if (ensemble.pathCount() < 2) {
            throw new IllegalArgumentException("채점에는 경로가 2개 이상 필요합니다: paths=" + ensemble.pathCount());
        }

        int stepCount = ensemble.getStepCount();
        int n = ensemble.pathCount() - 1;
        List<CrpsResult> results = new ArrayList<>(stepCount);
        int missing = 0;

        for (int k = 0; k < stepCount; k++) {
            long gridMs = ensemble.gridEpochMs(k);
            long elapsedSeconds = (long) k * ensemble.getIncrementSeconds();
            CrpsResult.CrpsResultBuilder builder = CrpsResult.builder()
                    .recordId(record.getRecordId())
                    .assetId(ensemble.getAssetId())
                    .t0EpochMs(ensemble.getT0EpochMs())
                    .stepIndex(k)
                    .gridEpochMs(gridMs)
                    .elapsedSeconds(elapsedSeconds)
                    .horizonBucket(HorizonBucket.ofElapsedSeconds(elapsedSeconds));

            Optional<Double> y = realized.priceAt(gridMs);
            if (y.isEmpty() || !Double.isFinite(y.get()) || y.get() <= 0) {
                missing++;
                results.add(builder.status(CrpsStatus.MISSING_REALIZED_DATA).build());
                continue;
            }

            double[] sorted = new double[n];
            for (int i = 0; i < n; i++) {
                sorted[i] = ensemble.price(i + 1, k);
            }
            Arrays.sort(sorted);
            double realizedPrice = y.get();

            results.add(builder.status(CrpsStatus.SCORED)
                    .crps(crps(sorted, realizedPrice))
                    .realizedPrice(realizedPrice)
                    .flatPathGap(Math.abs(ensemble.price(0, k) - realizedPrice))
                    .p5(percentile(sorted, 5))
                    .p50(percentile(sorted, 50))
                    .p95(percentile(sorted, 95))
                    .build());
        }

        if (missing > 0) {
            log.warn("[CRPS] 실현가 결측: recordId={}, asset={}, missing={}/{}",
                    record.getRecordId(), ensemble.getAssetId(), missing, stepCount);
        }
        log.debug("[CRPS] 채점 완료: recordId={}, asset={}, points={}, scored={}",
                record.getRecordId(), ensemble.getAssetId(), stepCount, stepCount - missing);
        return results;
    }

    /** sorted 는 오름차순 정렬된 앙상블 값. */
    static double crps(double[] sorted, double y) {
        int n = sorted.length;
        double absSum = 0.0;
        double weighted = 0.0;
        for (int k = 0; k < n; k++) {
            absSum += Math.abs(sorted[k] - y);
            weighted += (2.0 * k - n + 1) * sorted[k];
        }
        double meanAbs = absSum / n;
        double meanPair = 2.0 * weighted / ((double) n * n);
        return meanAbs - 0.5 * meanPair;
    }

    static double percentile(double[] sorted, int p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
