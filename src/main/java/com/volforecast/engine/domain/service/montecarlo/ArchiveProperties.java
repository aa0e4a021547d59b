package com.volforecast.engine.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.archive")
public class ArchiveProperties {

    private boolean enabled = true;
    private Duration lowInterval = Duration.ofMinutes(30);
    private Duration highInterval = Duration.ofMinutes(15);
}
