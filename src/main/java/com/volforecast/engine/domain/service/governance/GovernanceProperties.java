package com.volforecast.engine.domain.service.governance;

import com.volforecast.engine.domain.model.TunableParameter;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.governance")
public class GovernanceProperties {

    private Duration firstTuningWait = Duration.ofDays(14);
    private Duration minBetweenTunings = Duration.ofDays(30);
    private Duration observationPeriod = Duration.ofDays(14);

    private ParameterBounds decayLambda = new ParameterBounds(0.80, 0.99, 0.01, false, null);
    private ParameterBounds degreesOfFreedom = new ParameterBounds(3, 50, 1, true, null);
    private ParameterBounds dailyCap = new ParameterBounds(0.01, 0.20, 0.01, false, Duration.ofDays(90));

    public ParameterBounds bounds(TunableParameter parameter) {
        return switch (parameter) {
            case DECAY_LAMBDA -> decayLambda;
            case DEGREES_OF_FREEDOM -> degreesOfFreedom;
            case DAILY_CAP -> dailyCap;
        };
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParameterBounds {

        private double min;
        private double max;
        private double maxStep;
        private boolean integerOnly;

        /** 같은 파라미터의 직전 변경 이후 추가로 기다려야 하는 기간. 없으면 null. */
        private Duration minInterval;

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }
}
