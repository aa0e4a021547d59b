package com.volforecast.engine.domain.service.evaluation;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.CrpsStatus;
import com.volforecast.engine.domain.model.DiagnosticsReport;
import com.volforecast.engine.domain.model.HorizonBucket;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DiagnosticsAggregatorTest {

    private static final long DAY = 86_400_000L;
    private static final long T_END = 1_717_416_000_000L; // 2024-06-03T12:00Z

    private final DiagnosticsAggregator aggregator = new DiagnosticsAggregator();

    private static CrpsResult scored(String asset, long t0, int step, long elapsed, double crps) {
        return CrpsResult.builder()
                .recordId(asset + "-" + t0)
                .assetId(asset)
                .t0EpochMs(t0)
                .stepIndex(step)
                .elapsedSeconds(elapsed)
                .horizonBucket(HorizonBucket.ofElapsedSeconds(elapsed))
                .status(CrpsStatus.SCORED)
                .crps(crps)
                .realizedPrice(100.0)
                .build();
    }

    private static CrpsResult missing(String asset, long t0, int step) {
        return CrpsResult.builder()
                .recordId(asset + "-" + t0)
                .assetId(asset)
                .t0EpochMs(t0)
                .stepIndex(step)
                .horizonBucket(HorizonBucket.SHORT)
                .status(CrpsStatus.MISSING_REALIZED_DATA)
                .build();
    }

    @Test
    void reportDoesNotDependOnInputOrder() {
        List<CrpsResult> results = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            results.add(scored(i % 2 == 0 ? "BTC" : "ETH", T_END - (i % 5) * DAY, i, i * 60L, 0.1 * i + 0.013));
        }
        results.add(missing("BTC", T_END, 99));
        List<CrpsResult> shuffled = new ArrayList<>(results);
        Collections.shuffle(shuffled, new Random(17));

        DiagnosticsReport a = aggregator.aggregate(results, Duration.ofDays(7));
        DiagnosticsReport b = aggregator.aggregate(shuffled, Duration.ofDays(7));

        assertThat(b).usingRecursiveComparison().isEqualTo(a);
        assertThat(a.getScoredCount()).isEqualTo(40);
        assertThat(a.getMissingCount()).isEqualTo(1);
    }

    @Test
    void bucketStatsOnlyContainObservedBuckets() {
        List<CrpsResult> results = List.of(
                scored("BTC", T_END, 1, 60, 1.0),
                scored("BTC", T_END, 2, 120, 2.0),
                scored("BTC", T_END, 3, 180, 4.0));

        DiagnosticsReport report = aggregator.aggregate(results, Duration.ofDays(7));

        assertThat(report.getBucketStats()).containsOnlyKeys(HorizonBucket.SHORT);
        DiagnosticsReport.Stats stats = report.getBucketStats().get(HorizonBucket.SHORT);
        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.mean()).isCloseTo(7.0 / 3.0, within(1e-12));
        assertThat(stats.median()).isEqualTo(2.0);
        assertThat(stats.std()).isCloseTo(Math.sqrt(14.0 / 9.0), within(1e-12));
    }

    @Test
    void coverageCountsRealizedBelowQuantile() {
        List<CrpsResult> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(CrpsResult.builder()
                    .recordId("r" + i).assetId("BTC").t0EpochMs(T_END).stepIndex(1)
                    .horizonBucket(HorizonBucket.SHORT).status(CrpsStatus.SCORED)
                    .crps(1.0)
                    .realizedPrice(i < 9 ? 50.0 : 150.0)
                    .p95(100.0)
                    .build());
        }

        DiagnosticsReport report = aggregator.aggregate(results, Duration.ofDays(7));

        assertThat(report.getCoverage()).containsOnlyKeys(95);
        DiagnosticsReport.Coverage coverage = report.getCoverage().get(95);
        assertThat(coverage.observed()).isCloseTo(0.9, within(1e-12));
        assertThat(coverage.deviation()).isCloseTo(-0.05, within(1e-12));
        assertThat(coverage.samples()).isEqualTo(10);
    }

    @Test
    void rollingWindowIsHalfOpenAtStart() {
        List<CrpsResult> results = List.of(
                scored("BTC", T_END, 1, 60, 1.0),
                scored("BTC", T_END - DAY, 1, 60, 3.0),
                scored("BTC", T_END - 7 * DAY, 1, 60, 100.0),
                scored("ETH", T_END - 8 * DAY, 1, 60, 50.0));

        DiagnosticsReport report = aggregator.aggregate(results, Duration.ofDays(7));

        assertThat(report.getWindowEndEpochMs()).isEqualTo(T_END);
        assertThat(report.getWindowStartEpochMs()).isEqualTo(T_END - 7 * DAY);
        assertThat(report.getRollingMeanByAsset()).containsOnlyKeys("BTC");
        assertThat(report.getRollingMeanByAsset().get("BTC")).isEqualTo(2.0);
        assertThat(report.getDailyRollingByAsset().get("BTC"))
                .extracting(DiagnosticsReport.DailyPoint::day)
                .containsExactly("2024-06-02", "2024-06-03");
        assertThat(report.getOverall().count()).isEqualTo(4);
    }

    @Test
    void emptyInputGivesEmptyReport() {
        DiagnosticsReport report = aggregator.aggregate(List.of(), Duration.ofDays(7));

        assertThat(report.getScoredCount()).isZero();
        assertThat(report.getOverall()).isNull();
        assertThat(report.getBucketStats()).isEmpty();
        assertThat(report.getCoverage()).isEmpty();
        assertThat(report.getRollingMeanByAsset()).isEmpty();
    }
}
