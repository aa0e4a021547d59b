package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.exception.PathGenerationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.SplittableRandom;

/**
 * 경로 0 은 시작가 고정, 나머지 경로는 exp(shock) 누적곱. 같은 요청(시드 포함)이면 같은 결과를 낸다.
 */
@Slf4j
@Component
public class PricePathGenerator {

    private final ShockSampler shockSampler;
    private final Counter invalidPriceCounter;

    public PricePathGenerator(ShockSampler shockSampler, MeterRegistry meterRegistry) {
        this.shockSampler = shockSampler;
        this.invalidPriceCounter = Counter.builder("forecast.paths.invalid_prices")
                .description("Non-finite or non-positive prices produced by path generation")
                .register(meterRegistry);
    }

    public double[][] generate(PathGenerationRequest request) {
        validateRequest(request);

        int pathCount = request.getPathCount();
        int stepCount = request.getStepCount();
        MathContext mc = new MathContext(request.getSignificantDigits(), RoundingMode.HALF_EVEN);
        double s0 = round(request.getSpotPrice(), mc);

        double[][] paths = new double[pathCount][stepCount];
        for (int k = 0; k < stepCount; k++) {
            paths[0][k] = s0;
        }

        long startNano = System.nanoTime();
        if (request.isFlatten()) {
            for (int i = 1; i < pathCount; i++) {
                paths[i] = paths[0].clone();
            }
        } else {
            SplittableRandom rng = new SplittableRandom(request.getSeed());
            int steps = stepCount - 1;
            double[] shocks = shockSampler.sample(request.getDistributionFamily(), request.getStepSigma(),
                    (pathCount - 1) * steps, rng);

            int idx = 0;
            for (int i = 1; i < pathCount; i++) {
                double price = request.getSpotPrice();
                paths[i][0] = s0;
                for (int k = 1; k < stepCount; k++) {
                    price *= Math.exp(shocks[idx++]);
                    paths[i][k] = round(price, mc);
                }
            }
        }

        int invalid = countInvalid(paths);
        if (invalid > 0) {
            invalidPriceCounter.increment(invalid);
            throw new PathGenerationException("유효하지 않은 가격 " + invalid + "건이 생성되었습니다 (sigma="
                    + request.getStepSigma() + ", steps=" + stepCount + ")");
        }

        log.debug("[PathGen] 생성 완료: paths={}, steps={}, sigma={}, family={}, flatten={}, elapsed={}μs",
                pathCount, stepCount, String.format("%.6e", request.getStepSigma()),
                request.getDistributionFamily().kind(), request.isFlatten(),
                (System.nanoTime() - startNano) / 1_000);
        return paths;
    }

    static double round(double value, MathContext mc) {
        if (!Double.isFinite(value) || value == 0.0) return value;
        return new BigDecimal(value).round(mc).doubleValue();
    }

    private static int countInvalid(double[][] paths) {
        int invalid = 0;
        for (double[] path : paths) {
            for (double price : path) {
                if (!Double.isFinite(price) || price <= 0) invalid++;
            }
        }
        return invalid;
    }

    private void validateRequest(PathGenerationRequest request) {
        if (!Double.isFinite(request.getSpotPrice()) || request.getSpotPrice() <= 0) {
            throw new PathGenerationException("시작 가격은 유한한 양수여야 합니다: " + request.getSpotPrice());
        }
        if (request.getPathCount() < 1) {
            throw new IllegalArgumentException("경로 수(pathCount)는 양수여야 합니다");
        }
        if (request.getStepCount() < 1) {
            throw new IllegalArgumentException("스텝 수(stepCount)는 1 이상이어야 합니다");
        }
        if (request.getDistributionFamily() == null) {
            throw new IllegalArgumentException("분포(distributionFamily)가 필요합니다");
        }
        if (!request.isFlatten() && !(Double.isFinite(request.getStepSigma()) && request.getStepSigma() > 0)) {
            throw new PathGenerationException("스텝 변동성은 유한한 양수여야 합니다: " + request.getStepSigma());
        }
    }
}
