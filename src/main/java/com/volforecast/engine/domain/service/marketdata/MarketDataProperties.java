package com.volforecast.engine.domain.service.marketdata;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.market-data")
public class MarketDataProperties {

    private int historyCapacity = 262_144;
    private long realizedToleranceMs = 60_000;
}
