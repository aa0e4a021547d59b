package com.volforecast.engine.domain.service.scaling;

import com.volforecast.engine.domain.exception.InvalidScalingException;
import com.volforecast.engine.domain.model.HorizonLabel;
import com.volforecast.engine.domain.model.ScalingParameters;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.service.ForecastProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 기본 간격 분산을 요청 간격의 스텝 변동성으로 변환한다.
 * 일간 환산 후 dailyCap 으로 상한을 두고, HIGH 라벨은 frequencyShrinkHigh 를 곱한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VolatilityScaler {

    static final double SECONDS_PER_DAY = 86_400.0;

    private final ForecastProperties properties;

    public double toStepVolatility(VolatilityState state,
                                   int incrementSeconds,
                                   HorizonLabel label,
                                   ScalingParameters scaling) {
        validate(incrementSeconds, scaling);

        double sigmaBase = Math.sqrt(state.getVarianceEstimate());
        double sigmaDaily = sigmaBase * Math.sqrt(SECONDS_PER_DAY / properties.getBaseIntervalSeconds());
        boolean capped = sigmaDaily > scaling.getDailyCap();
        if (capped) {
            sigmaDaily = scaling.getDailyCap();
        }

        double sigmaStep = sigmaDaily * Math.sqrt(incrementSeconds / SECONDS_PER_DAY);
        if (label == HorizonLabel.HIGH) {
            sigmaStep *= scaling.getFrequencyShrinkHigh();
        }

        if (!Double.isFinite(sigmaStep) || sigmaStep <= 0) {
            throw new InvalidScalingException("스텝 변동성이 유효하지 않습니다: asset=" + state.getAssetId()
                    + ", sigmaStep=" + sigmaStep);
        }

        log.debug("[Scaler] asset={}, label={}, sigmaDaily={}, capped={}, sigmaStep={}",
                state.getAssetId(), label, String.format("%.6f", sigmaDaily), capped,
                String.format("%.6e", sigmaStep));
        return sigmaStep;
    }

    private void validate(int incrementSeconds, ScalingParameters scaling) {
        if (incrementSeconds <= 0) {
            throw new InvalidScalingException("시간 간격(incrementSeconds)은 양수여야 합니다: " + incrementSeconds);
        }
        if (!(scaling.getDailyCap() > 0)) {
            throw new InvalidScalingException("일간 상한(dailyCap)은 양수여야 합니다: " + scaling.getDailyCap());
        }
        double shrink = scaling.getFrequencyShrinkHigh();
        if (!(shrink > 0) || shrink > 1.0) {
            throw new InvalidScalingException("고빈도 축소 계수는 (0, 1] 범위여야 합니다: " + shrink);
        }
        if (properties.getBaseIntervalSeconds() <= 0) {
            throw new InvalidScalingException("기본 간격은 양수여야 합니다: " + properties.getBaseIntervalSeconds());
        }
    }
}
