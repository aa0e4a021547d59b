package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.exception.MarketDataUnavailableException;
import com.volforecast.engine.domain.model.HorizonLabel;
import com.volforecast.engine.domain.model.ParameterSnapshot;
import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.model.ScalingParameters;
import com.volforecast.engine.domain.model.SpotQuote;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import com.volforecast.engine.domain.service.ForecastProperties;
import com.volforecast.engine.domain.service.marketdata.MarketDataGateway;
import com.volforecast.engine.domain.service.scaling.MarketHoursGate;
import com.volforecast.engine.domain.service.scaling.VolatilityScaler;
import com.volforecast.engine.domain.service.volatility.VolatilityStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Service
public class PathForecastService {

    private final AssetParameterRegistry registry;
    private final MarketDataGateway marketDataGateway;
    private final VolatilityStateStore stateStore;
    private final VolatilityScaler scaler;
    private final MarketHoursGate marketHoursGate;
    private final PricePathGenerator pathGenerator;
    private final PredictionArchiver archiver;
    private final ForecastProperties properties;
    private final Timer generationTimer;

    public PathForecastService(AssetParameterRegistry registry,
                               MarketDataGateway marketDataGateway,
                               VolatilityStateStore stateStore,
                               VolatilityScaler scaler,
                               MarketHoursGate marketHoursGate,
                               PricePathGenerator pathGenerator,
                               PredictionArchiver archiver,
                               ForecastProperties properties,
                               MeterRegistry meterRegistry) {
        this.registry = registry;
        this.marketDataGateway = marketDataGateway;
        this.stateStore = stateStore;
        this.scaler = scaler;
        this.marketHoursGate = marketHoursGate;
        this.pathGenerator = pathGenerator;
        this.archiver = archiver;
        this.properties = properties;
        this.generationTimer = Timer.builder("forecast.paths.generation")
                .description("Path ensemble generation latency")
                .register(meterRegistry);
    }

    public PathEnsemble generate(String assetId, long t0EpochMs, int incrementSeconds, int stepCount) {
        return generate(assetId, t0EpochMs, incrementSeconds, stepCount, null);
    }

    public PathEnsemble generate(String assetId, long t0EpochMs, int incrementSeconds, int stepCount, Long seed) {
        registry.profile(assetId);
        String asset = AssetParameterRegistry.normalize(assetId);
        validateRequest(incrementSeconds, stepCount);

        SpotQuote spot = marketDataGateway.getSpot(asset)
                .orElseThrow(() -> new MarketDataUnavailableException("현재가를 조회할 수 없습니다: asset=" + asset));
        if (!Double.isFinite(spot.price()) || spot.price() <= 0) {
            throw new MarketDataUnavailableException("현재가가 유효하지 않습니다: asset=" + asset + ", price=" + spot.price());
        }

        VolatilityState state = stateStore.get(asset);
        ScalingParameters scaling = registry.scalingParameters(asset);
        boolean flatten = marketHoursGate.shouldFlatten(scaling, t0EpochMs);
        HorizonLabel label = HorizonLabel.forIncrement(incrementSeconds, properties.getHighFrequencyMaxIncrementSeconds());
        double stepSigma = flatten ? 0.0 : scaler.toStepVolatility(state, incrementSeconds, label, scaling);
        long effectiveSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();

        PathGenerationRequest request = PathGenerationRequest.builder()
                .spotPrice(spot.price())
                .stepSigma(stepSigma)
                .stepCount(stepCount)
                .pathCount(properties.getPathCount())
                .distributionFamily(scaling.getDistributionFamily())
                .flatten(flatten)
                .seed(effectiveSeed)
                .significantDigits(properties.getSignificantDigits())
                .build();

        double[][] paths = generationTimer.record(() -> pathGenerator.generate(request));
        PathEnsemble ensemble = new PathEnsemble(asset, t0EpochMs, incrementSeconds, stepCount, spot.price(), paths);

        ParameterSnapshot snapshot = ParameterSnapshot.builder()
                .distributionKind(scaling.getDistributionFamily().kind())
                .degreesOfFreedom(scaling.getDistributionFamily().degreesOfFreedom())
                .decayLambda(registry.currentValue(asset, TunableParameter.DECAY_LAMBDA))
                .dailyCap(scaling.getDailyCap())
                .frequencyShrinkHigh(scaling.getFrequencyShrinkHigh())
                .horizonLabel(label)
                .stepSigma(stepSigma)
                .flattened(flatten)
                .seed(effectiveSeed)
                .varianceEstimate(state.getVarianceEstimate())
                .build();
        archiver.offer(ensemble, snapshot);

        log.info("[Forecast] 앙상블 생성: asset={}, t0={}, increment={}s, steps={}, label={}, sigma={}, flatten={}",
                asset, t0EpochMs, incrementSeconds, stepCount, label, String.format("%.6e", stepSigma), flatten);
        return ensemble;
    }

    private void validateRequest(int incrementSeconds, int stepCount) {
        if (incrementSeconds <= 0) {
            throw new IllegalArgumentException("시간 간격(increment)은 양수여야 합니다: " + incrementSeconds);
        }
        if (stepCount < 1 || stepCount > properties.getMaxStepCount()) {
            throw new IllegalArgumentException("스텝 수(steps)는 1 이상 " + properties.getMaxStepCount()
                    + " 이하여야 합니다: " + stepCount);
        }
    }
}
