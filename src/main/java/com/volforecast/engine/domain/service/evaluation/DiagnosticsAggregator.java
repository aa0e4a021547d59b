package com.volforecast.engine.domain.service.evaluation;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.DiagnosticsReport;
import com.volforecast.engine.domain.model.DiagnosticsReport.Coverage;
import com.volforecast.engine.domain.model.DiagnosticsReport.DailyPoint;
import com.volforecast.engine.domain.model.DiagnosticsReport.Stats;
import com.volforecast.engine.domain.model.HorizonBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * CRPS 결과 집계. 입력은 정규 순서로 정렬한 뒤 합산하므로 입력 순서와 무관하게 같은 리포트가 나온다.
 * 롤링 구간은 (마지막 t0 - window, 마지막 t0].
 */
@Slf4j
@Component
public class DiagnosticsAggregator {

    static final int[] COVERAGE_LEVELS = {5, 50, 95};

    private static final Comparator<CrpsResult> CANONICAL_ORDER = Comparator
            .comparing(CrpsResult::getAssetId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(CrpsResult::getT0EpochMs)
            .thenComparing(CrpsResult::getRecordId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(CrpsResult::getStepIndex);

    public DiagnosticsReport aggregate(List<CrpsResult> results, Duration window) {
        List<CrpsResult> ordered = new ArrayList<>(results);
        ordered.sort(CANONICAL_ORDER);

        List<CrpsResult> scored = ordered.stream()
                .filter(r -> r.isScored() && r.getCrps() != null)
                .toList();
        long missing = ordered.size() - scored.size();

        DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder()
                .scoredCount(scored.size())
                .missingCount(missing)
                .coverage(coverage(scored))
                .bucketStats(bucketStats(scored))
                .overall(scored.isEmpty() ? null : stats(values(scored)));

        if (!ordered.isEmpty()) {
            long end = ordered.stream().mapToLong(CrpsResult::getT0EpochMs).max().getAsLong();
            long start = end - window.toMillis();
            List<CrpsResult> inWindow = scored.stream()
                    .filter(r -> r.getT0EpochMs() > start && r.getT0EpochMs() <= end)
                    .toList();
            report.windowStartEpochMs(start)
                    .windowEndEpochMs(end)
                    .rollingMeanByAsset(rollingMeans(inWindow))
                    .dailyRollingByAsset(dailyPoints(inWindow));
        } else {
            report.rollingMeanByAsset(Map.of())
                    .dailyRollingByAsset(Map.of());
        }

        log.debug("[Diagnostics] 집계: scored={}, missing={}, window={}", scored.size(), missing, window);
        return report.build();
    }

    private Map<Integer, Coverage> coverage(List<CrpsResult> scored) {
        Map<Integer, Coverage> coverage = new LinkedHashMap<>();
        for (int level : COVERAGE_LEVELS) {
            long samples = 0;
            long below = 0;
            for (CrpsResult r : scored) {
                Double q = quantile(r, level);
                if (q == null || r.getRealizedPrice() == null) continue;
                samples++;
                if (r.getRealizedPrice() < q) below++;
            }
            if (samples == 0) continue;
            double nominal = level / 100.0;
            double observed = (double) below / samples;
            coverage.put(level, new Coverage(nominal, observed, observed - nominal, samples));
        }
        return coverage;
    }

    private Map<HorizonBucket, Stats> bucketStats(List<CrpsResult> scored) {
        Map<HorizonBucket, List<CrpsResult>> byBucket = new EnumMap<>(HorizonBucket.class);
        for (CrpsResult r : scored) {
            byBucket.computeIfAbsent(r.getHorizonBucket(), b -> new ArrayList<>()).add(r);
        }
        Map<HorizonBucket, Stats> stats = new EnumMap<>(HorizonBucket.class);
        byBucket.forEach((bucket, rows) -> stats.put(bucket, stats(values(rows))));
        return stats;
    }

    private Map<String, Double> rollingMeans(List<CrpsResult> inWindow) {
        Map<String, List<CrpsResult>> byAsset = new TreeMap<>();
        for (CrpsResult r : inWindow) {
            byAsset.computeIfAbsent(r.getAssetId(), a -> new ArrayList<>()).add(r);
        }
        Map<String, Double> means = new TreeMap<>();
        byAsset.forEach((asset, rows) -> means.put(asset, mean(values(rows))));
        return means;
    }

    private Map<String, List<DailyPoint>> dailyPoints(List<CrpsResult> inWindow) {
        Map<String, Map<String, List<CrpsResult>>> byAssetDay = new TreeMap<>();
        for (CrpsResult r : inWindow) {
            String day = Instant.ofEpochMilli(r.getT0EpochMs()).atZone(ZoneOffset.UTC).toLocalDate().toString();
            byAssetDay.computeIfAbsent(r.getAssetId(), a -> new TreeMap<>())
                    .computeIfAbsent(day, d -> new ArrayList<>())
                    .add(r);
        }
        Map<String, List<DailyPoint>> points = new TreeMap<>();
        byAssetDay.forEach((asset, days) -> {
            List<DailyPoint> series = new ArrayList<>();
            days.forEach((day, rows) -> series.add(new DailyPoint(day, mean(values(rows)), rows.size())));
            points.put(asset, series);
        });
        return points;
    }

    private static Double quantile(CrpsResult r, int level) {
        return switch (level) {
            case 5 -> r.getP5();
            case 50 -> r.getP50();
            case 95 -> r.getP95();
            default -> null;
        };
    }

    /** 합산 순서 고정을 위해 정렬된 값 배열을 돌려준다. */
    private static double[] values(List<CrpsResult> rows) {
        double[] values = rows.stream().mapToDouble(CrpsResult::getCrps).toArray();
        Arrays.sort(values);
        return values;
    }

    private static double mean(double[] sorted) {
        double sum = 0.0;
        for (double v : sorted) sum += v;
        return sum / sorted.length;
    }

    static Stats stats(double[] sorted) {
        double mean = mean(sorted);
        double sq = 0.0;
        for (double v : sorted) {
            double d = v - mean;
            sq += d * d;
        }
        double std = Math.sqrt(sq / sorted.length);
        return new Stats(mean, CrpsEvaluator.percentile(sorted, 50), std, sorted.length);
    }
}
