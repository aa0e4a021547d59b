package com.volforecast.engine.domain.service.evaluation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.replay")
public class ReplayProperties {

    private boolean enabled = false;
    private long intervalMs = 300_000;

    /** 채점 대상으로 조회할 t0 범위. */
    private Duration lookback = Duration.ofDays(7);

    /** 마지막 그리드 시점 이후 실현가가 도착할 때까지 기다리는 시간. */
    private Duration settleDelay = Duration.ofMinutes(2);
}
