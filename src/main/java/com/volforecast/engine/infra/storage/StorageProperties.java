package com.volforecast.engine.infra.storage;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "forecast.storage")
public class StorageProperties {

    private String baseDir = "data";
    private long snapshotIntervalMs = 60_000;

    public Path basePath() {
        return Path.of(baseDir);
    }
}
