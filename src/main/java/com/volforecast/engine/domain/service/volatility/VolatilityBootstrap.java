package com.volforecast.engine.domain.service.volatility;

import com.volforecast.engine.domain.model.AssetClass;
import com.volforecast.engine.domain.model.RealizedPriceSeries;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import com.volforecast.engine.domain.service.ForecastProperties;
import com.volforecast.engine.domain.service.marketdata.MarketDataGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 저장된 상태가 없는 자산의 초기 분산 추정.
 * 자산 클래스별 lookback 구간을 기본 간격(60s) 그리드로 조회해 인접한 두 점이 모두 있는 경우만 로그수익률로 쓴다.
 */
@Slf4j
@Component
public class VolatilityBootstrap {

    private final MarketDataGateway marketDataGateway;
    private final AssetParameterRegistry registry;
    private final ForecastProperties properties;
    private final Clock clock;
    private final Counter historyCounter;
    private final Counter fallbackCounter;

    public VolatilityBootstrap(MarketDataGateway marketDataGateway,
                               AssetParameterRegistry registry,
                               ForecastProperties properties,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.marketDataGateway = marketDataGateway;
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
        this.historyCounter = Counter.builder("forecast.volatility.bootstrap")
                .tag("source", "history")
                .description("Bootstraps seeded from price history")
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("forecast.volatility.bootstrap")
                .tag("source", "fallback")
                .description("Bootstraps that fell back to the configured variance")
                .register(meterRegistry);
    }

    public VolatilityState bootstrap(String assetId) {
        AssetClass assetClass = registry.assetClass(assetId);
        double lambda = registry.decayLambda(assetId);
        long baseMs = properties.getBaseIntervalSeconds() * 1000L;
        long endMs = Math.floorDiv(clock.millis(), baseMs) * baseMs;
        long startMs = endMs - assetClass.getBootstrapLookback().toMillis();

        List<Long> grid = new ArrayList<>();
        for (long ts = startMs; ts <= endMs; ts += baseMs) {
            grid.add(ts);
        }

        RealizedPriceSeries series;
        try {
            series = marketDataGateway.getRealized(assetId, grid);
        } catch (RuntimeException e) {
            log.warn("[Bootstrap] 이력 조회 실패, 기본 분산 사용: asset={}, cause={}", assetId, e.toString());
            return fallback(assetId, lambda);
        }

        double sumSquares = 0.0;
        int returns = 0;
        Double lastPrice = null;
        long lastTs = 0L;
        Double prev = null;
        for (Long ts : grid) {
            Double price = series.priceAt(ts).orElse(null);
            if (price != null && (!Double.isFinite(price) || price <= 0)) {
                price = null;
            }
            if (price != null && prev != null) {
                double r = Math.log(price / prev);
                sumSquares += r * r;
                returns++;
            }
            if (price != null) {
                lastPrice = price;
                lastTs = ts;
            }
            prev = price;
        }

        if (returns < properties.getMinBootstrapReturns()) {
            log.info("[Bootstrap] 수익률 표본 부족: asset={}, returns={}, min={}",
                    assetId, returns, properties.getMinBootstrapReturns());
            return fallback(assetId, lambda);
        }
        double variance = sumSquares / returns;
        if (!Double.isFinite(variance) || variance <= 0) {
            log.warn("[Bootstrap] 이력 분산이 유효하지 않음: asset={}, variance={}", assetId, variance);
            return fallback(assetId, lambda);
        }

        historyCounter.increment();
        log.info("[Bootstrap] 이력 기반 초기화: asset={}, class={}, returns={}, variance={}",
                assetId, assetClass, returns, String.format("%.3e", variance));
        return VolatilityState.builder()
                .assetId(assetId)
                .varianceEstimate(variance)
                .decayLambda(lambda)
                .lastUpdateEpochMs(lastTs)
                .sampleCount(returns)
                .lastPrice(lastPrice)
                .build();
    }

    private VolatilityState fallback(String assetId, double lambda) {
        fallbackCounter.increment();
        double variance = registry.bootstrapVariance(assetId);
        log.info("[Bootstrap] 기본 분산으로 초기화: asset={}, variance={}", assetId, String.format("%.3e", variance));
        return VolatilityState.builder()
                .assetId(assetId)
                .varianceEstimate(variance)
                .decayLambda(lambda)
                .lastUpdateEpochMs(0L)
                .sampleCount(0L)
                .build();
    }
}
