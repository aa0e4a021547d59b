package com.volforecast.engine.domain.service.scaling;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.market-hours")
public class MarketHoursProperties {

    /** UTC 기준 정규장 시작 (포함), HH:mm. */
    private String open = "14:30";

    /** UTC 기준 정규장 종료 (미포함), HH:mm. */
    private String close = "21:00";

    public LocalTime openTime() {
        return LocalTime.parse(open);
    }

    public LocalTime closeTime() {
        return LocalTime.parse(close);
    }
}
